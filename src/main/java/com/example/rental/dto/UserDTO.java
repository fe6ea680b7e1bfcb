package com.example.rental.dto;

import com.example.rental.model.User;

import java.time.LocalDateTime;

public record UserDTO(Long telegramId, String username, String firstName, String lastName, String phone,
                      boolean manager, boolean blacklisted, LocalDateTime lastActivity) {

    public static UserDTO from(User u) {
        return new UserDTO(u.getTelegramId(), u.getUsername(), u.getFirstName(), u.getLastName(),
                u.getPhone(), u.isManager(), u.isBlacklisted(), u.getLastActivity());
    }
}
