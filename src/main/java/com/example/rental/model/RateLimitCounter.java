package com.example.rental.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "rate_limits")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitCounter {

    @Id
    private Long userId;

    @Column(nullable = false)
    private LocalDateTime windowStart;

    @Column(nullable = false)
    private int count;
}
