package com.example.rental.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_item_date", columnList = "item_id, booking_date"),
        @Index(name = "idx_bookings_user", columnList = "user_id")
})
@Getter @Setter
public class Booking {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Telegram id of the owner; for manager-created bookings the manager. */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    private String userName;

    private String userNickname;

    @Column(length = 32)
    private String phone;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    private String itemName;

    @Column(name = "booking_date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status = BookingStatus.PENDING;

    @Column(length = 1000)
    private String comment;

    // bumped manually by versioned updates in BookingStore, not by the JPA provider
    @Column(nullable = false)
    private long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
