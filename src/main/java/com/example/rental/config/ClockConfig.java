package com.example.rental.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${bot.timezone:Europe/Moscow}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
