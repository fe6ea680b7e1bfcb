package com.example.rental.service.impl;

import com.example.rental.model.Item;
import com.example.rental.service.ItemService;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.exception.ValidationException;
import com.example.rental.store.ItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ItemServiceImpl implements ItemService {

    private final ItemStore itemStore;

    @Override
    public List<Item> listActive() {
        return itemStore.listActiveItemsSorted();
    }

    @Override
    public Optional<Item> findById(Long id) {
        return itemStore.getItemById(id);
    }

    @Override
    public Optional<Item> findByName(String name) {
        return itemStore.getItemByName(name.trim());
    }

    @Override
    public Item create(String name, int totalQuantity) {
        requirePositive(totalQuantity);
        Item item = itemStore.createItem(name.trim(), null, totalQuantity);
        log.info("Item created: id={}, name='{}', qty={}", item.getId(), item.getName(), totalQuantity);
        return item;
    }

    @Override
    public Item updateQuantity(String name, int totalQuantity) {
        requirePositive(totalQuantity);
        Item item = require(name);
        Item updated = itemStore.updateItem(item.getId(), null, null, totalQuantity);
        log.info("Item updated: id={}, qty {} -> {}", item.getId(), item.getTotalQuantity(), totalQuantity);
        return updated;
    }

    @Override
    public Item deactivate(String name) {
        Item item = itemStore.deactivateItem(require(name).getId());
        log.info("Item deactivated: id={}, name='{}'", item.getId(), item.getName());
        return item;
    }

    @Override
    public Item setOrder(String name, int order) {
        return itemStore.reorderItem(require(name).getId(), order);
    }

    @Override
    public Item move(String name, int delta) {
        Item item = require(name);
        return itemStore.reorderItem(item.getId(), item.getSortOrder() + delta);
    }

    private Item require(String name) {
        return findByName(name).orElseThrow(() -> new NotFoundException("Item", name));
    }

    private static void requirePositive(int totalQuantity) {
        if (totalQuantity < 1) {
            throw new ValidationException("Количество должно быть не меньше 1.");
        }
    }
}
