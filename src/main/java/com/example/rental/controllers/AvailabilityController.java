package com.example.rental.controllers;

import com.example.rental.dto.AvailabilityDTO;
import com.example.rental.dto.ItemDTO;
import com.example.rental.model.Item;
import com.example.rental.service.BookingService;
import com.example.rental.service.ItemService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read-only catalogue and availability lookups. */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AvailabilityController {

    private final ItemService itemService;
    private final BookingService bookingService;
    private final Clock clock;

    @GetMapping("/items")
    public List<ItemDTO> items() {
        return itemService.listActive().stream().map(ItemDTO::from).toList();
    }

    /** {@code date} defaults to today. */
    @GetMapping("/availability/{itemName}")
    public ResponseEntity<?> availability(@PathVariable String itemName,
                                          @RequestParam(required = false) String date) {
        LocalDate day;
        try {
            day = date == null || date.isBlank() ? LocalDate.now(clock) : LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid date, expected YYYY-MM-DD"));
        }
        Optional<Item> item = itemService.findByName(itemName);
        if (item.isEmpty()) {
            log.debug("Availability requested for unknown item '{}'", itemName);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Item not found"));
        }
        Item found = item.get();
        long booked = bookingService.bookedCount(found.getId(), day);
        return ResponseEntity.ok(new AvailabilityDTO(found.getName(), day, booked < found.getTotalQuantity(),
                booked, found.getTotalQuantity()));
    }
}
