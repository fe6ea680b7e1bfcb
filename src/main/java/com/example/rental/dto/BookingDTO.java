package com.example.rental.dto;

import com.example.rental.model.Booking;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Detached copy of a booking. Used for outbox payloads, events and the mirror sink.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingDTO {
    private Long id;
    private Long userId;
    private String userName;
    private String userNickname;
    private String phone;
    private Long itemId;
    private String itemName;
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;
    private String status;
    private String comment;
    private long version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static BookingDTO from(Booking b) {
        return BookingDTO.builder()
                .id(b.getId())
                .userId(b.getUserId())
                .userName(b.getUserName())
                .userNickname(b.getUserNickname())
                .phone(b.getPhone())
                .itemId(b.getItemId())
                .itemName(b.getItemName())
                .date(b.getDate())
                .status(b.getStatus().code())
                .comment(b.getComment())
                .version(b.getVersion())
                .createdAt(b.getCreatedAt())
                .updatedAt(b.getUpdatedAt())
                .build();
    }
}
