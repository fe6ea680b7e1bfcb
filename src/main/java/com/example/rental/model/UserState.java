package com.example.rental.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "user_states")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserState {

    @Id
    private Long userId;

    @Column(nullable = false, length = 64)
    private String step;

    /** scratch key/value map as JSON */
    @Lob
    @Column(columnDefinition = "CLOB")
    private String data;

    private LocalDateTime updatedAt;
}
