package com.example.rental.service;

import com.example.rental.model.Item;

import java.util.List;
import java.util.Optional;

public interface ItemService {

    List<Item> listActive();

    Optional<Item> findById(Long id);

    /** Active item by name, case-insensitive. */
    Optional<Item> findByName(String name);

    Item create(String name, int totalQuantity);

    /** Changes the capacity of the named item. */
    Item updateQuantity(String name, int totalQuantity);

    Item deactivate(String name);

    Item setOrder(String name, int order);

    /** Shifts the sort order by {@code delta}, never below 1. */
    Item move(String name, int delta);
}
