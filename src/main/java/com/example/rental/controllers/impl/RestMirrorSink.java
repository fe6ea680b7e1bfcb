package com.example.rental.controllers.impl;

import com.example.rental.controllers.MirrorSink;
import com.example.rental.dto.BookingDTO;
import com.example.rental.dto.ItemDTO;
import com.example.rental.dto.UserDTO;
import com.example.rental.service.exception.RemoteSinkException;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Mirror writer talking JSON to the spreadsheet gateway.
 */
@Slf4j
public class RestMirrorSink implements MirrorSink {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestMirrorSink(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void appendBooking(BookingDTO booking) {
        send(HttpMethod.POST, "/bookings", booking, "append booking " + booking.getId());
    }

    @Override
    public void upsertBooking(BookingDTO booking) {
        send(HttpMethod.PUT, "/bookings/" + booking.getId(), booking, "upsert booking " + booking.getId());
    }

    @Override
    public void updateBookingStatus(Long bookingId, String status) {
        send(HttpMethod.POST, "/bookings/" + bookingId + "/status", new StatusRequest(status),
                "update status of booking " + bookingId);
    }

    @Override
    public void replaceBookingsSheet(List<BookingDTO> bookings) {
        send(HttpMethod.PUT, "/bookings", bookings, "replace bookings sheet");
    }

    @Override
    public void updateUsersSheet(List<UserDTO> users) {
        send(HttpMethod.PUT, "/users", users, "update users sheet");
    }

    @Override
    public void updateScheduleSheet(LocalDate start, LocalDate end,
                                    Map<LocalDate, List<BookingDTO>> dailyBookings, List<ItemDTO> items) {
        send(HttpMethod.PUT, "/schedule", new ScheduleRequest(start, end, dailyBookings, items),
                "update schedule " + start + ".." + end);
    }

    private void send(HttpMethod method, String path, Object body, String what) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(body, headers), Void.class);
        } catch (HttpStatusCodeException e) {
            log.warn("Mirror rejected {}: {} {}", what, e.getStatusCode(), e.getResponseBodyAsString());
            boolean retryable = e.getStatusCode().is5xxServerError()
                    || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    || e.getStatusCode().value() == HttpStatus.REQUEST_TIMEOUT.value();
            throw new RemoteSinkException("Mirror " + what + " failed with " + e.getStatusCode(), retryable, e);
        } catch (ResourceAccessException e) {
            throw new RemoteSinkException("Mirror unreachable during " + what + ": " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new RemoteSinkException("Mirror " + what + " failed: " + e.getMessage(), true, e);
        }
    }

    private record StatusRequest(String status) {}

    private record ScheduleRequest(@JsonFormat(pattern = "yyyy-MM-dd") LocalDate start,
                                   @JsonFormat(pattern = "yyyy-MM-dd") LocalDate end,
                                   Map<LocalDate, List<BookingDTO>> daily,
                                   List<ItemDTO> items) {}
}
