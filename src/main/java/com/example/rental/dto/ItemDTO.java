package com.example.rental.dto;

import com.example.rental.model.Item;

public record ItemDTO(Long id, String name, String description, int totalQuantity, int sortOrder) {

    public static ItemDTO from(Item item) {
        return new ItemDTO(item.getId(), item.getName(), item.getDescription(),
                item.getTotalQuantity(), item.getSortOrder());
    }
}
