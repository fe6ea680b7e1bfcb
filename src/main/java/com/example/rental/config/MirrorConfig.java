package com.example.rental.config;

import com.example.rental.controllers.MirrorSink;
import com.example.rental.controllers.impl.InMemoryMirrorSink;
import com.example.rental.controllers.impl.RestMirrorSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class MirrorConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(20))
                .build();
    }

    @Bean
    public MirrorSink mirrorSink(RestTemplate restTemplate,
                                 @Value("${mirror.api.base-url:}") String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("mirror.api.base-url is not set, mirror writes stay in memory");
            return new InMemoryMirrorSink();
        }
        log.info("Mirror writes go to {}", baseUrl);
        return new RestMirrorSink(restTemplate, baseUrl);
    }
}
