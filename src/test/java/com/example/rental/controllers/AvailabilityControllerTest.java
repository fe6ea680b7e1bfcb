package com.example.rental.controllers;

import com.example.rental.dto.AvailabilityDTO;
import com.example.rental.dto.ItemDTO;
import com.example.rental.model.Item;
import com.example.rental.service.BookingService;
import com.example.rental.service.ItemService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class AvailabilityControllerTest {

    private ItemService itemService;
    private BookingService bookingService;
    private AvailabilityController controller;

    @BeforeEach
    void setUp() {
        itemService = Mockito.mock(ItemService.class);
        bookingService = Mockito.mock(BookingService.class);
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T07:00:00Z"), ZoneId.of("Europe/Moscow"));
        controller = new AvailabilityController(itemService, bookingService, clock);

        Item drone = new Item();
        drone.setId(2L);
        drone.setName("DJI Mini");
        drone.setTotalQuantity(2);
        drone.setSortOrder(1);
        when(itemService.findByName("dji mini")).thenReturn(Optional.of(drone));
        when(itemService.listActive()).thenReturn(List.of(drone));
    }

    @Test
    void listsActiveItems() {
        assertThat(controller.items()).containsExactly(new ItemDTO(2L, "DJI Mini", null, 2, 1));
    }

    @Test
    void reportsRemainingCapacity() {
        when(bookingService.bookedCount(2L, LocalDate.of(2025, 6, 10))).thenReturn(1L);

        ResponseEntity<?> response = controller.availability("dji mini", "2025-06-10");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .isEqualTo(new AvailabilityDTO("DJI Mini", LocalDate.of(2025, 6, 10), true, 1, 2));
    }

    @Test
    void dateDefaultsToToday() {
        when(bookingService.bookedCount(2L, LocalDate.of(2025, 6, 1))).thenReturn(2L);

        ResponseEntity<?> response = controller.availability("dji mini", null);

        assertThat(response.getBody())
                .isEqualTo(new AvailabilityDTO("DJI Mini", LocalDate.of(2025, 6, 1), false, 2, 2));
    }

    @Test
    void malformedDateIsABadRequest() {
        ResponseEntity<?> response = controller.availability("dji mini", "10.06.2025");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "Invalid date, expected YYYY-MM-DD"));
    }

    @Test
    void unknownItemIsNotFound() {
        when(itemService.findByName(any())).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.availability("GoPro", "2025-06-10");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
