package com.example.rental.service.event;

import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.service.BookingService;
import com.example.rental.service.BotMetrics;
import com.example.rental.service.ChatSender;
import com.example.rental.service.UserService;
import com.example.rental.service.handler.BookingCards;
import com.example.rental.service.util.DateInputParser;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Chat notifications driven by booking events: new pending requests go to every manager,
 * status changes made by someone else go to the booking owner.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingNotificationListener {

    private final DomainEventBus eventBus;
    private final ChatSender sender;
    private final UserService userService;
    private final BookingService bookingService;
    private final BotMetrics metrics;

    @PostConstruct
    public void subscribe() {
        eventBus.subscribe(EventType.BOOKING_CREATED, this::onCreated);
        eventBus.subscribe(EventType.BOOKING_CONFIRMED, this::onOwnerUpdate);
        eventBus.subscribe(EventType.BOOKING_CANCELED, this::onOwnerUpdate);
        eventBus.subscribe(EventType.BOOKING_COMPLETED, this::onOwnerUpdate);
        eventBus.subscribe(EventType.BOOKING_ITEM_CHANGED, this::onOwnerUpdate);
    }

    void onCreated(DomainEvent event) throws Exception {
        BookingEventPayload payload = eventBus.decode(event, BookingEventPayload.class);
        metrics.eventHandled(event.type().code());
        if (!BookingStatus.PENDING.code().equals(payload.status())) {
            return;
        }
        Booking booking = bookingService.findBooking(payload.bookingId()).orElse(null);
        if (booking == null) {
            log.warn("Booking {} from event is gone, skipping manager notification", payload.bookingId());
            return;
        }
        String text = "🆕 Новая заявка\n\n" + BookingCards.text(booking);
        for (Long managerId : userService.managerIds()) {
            sender.send(managerId, text, BookingCards.actions(booking));
        }
    }

    void onOwnerUpdate(DomainEvent event) throws Exception {
        BookingEventPayload payload = eventBus.decode(event, BookingEventPayload.class);
        metrics.eventHandled(event.type().code());
        if (payload.userId() == null || Objects.equals(payload.changedById(), payload.userId())) {
            return;
        }
        sender.sendText(payload.userId(), ownerText(event.type(), payload));
    }

    static String ownerText(EventType type, BookingEventPayload p) {
        String subject = "Ваша заявка #%d на %s (%s)".formatted(p.bookingId(), p.itemName(),
                DateInputParser.format(p.date()));
        return switch (type) {
            case BOOKING_CONFIRMED -> "✅ " + subject + " подтверждена.";
            case BOOKING_CANCELED -> "❌ " + subject + " отменена.";
            case BOOKING_COMPLETED -> "🏁 " + subject + " завершена. Спасибо!";
            case BOOKING_ITEM_CHANGED -> "🔄 В заявке #%d изменен аппарат: теперь %s (%s)."
                    .formatted(p.bookingId(), p.itemName(), DateInputParser.format(p.date()));
            case BOOKING_CREATED -> "📋 " + subject + " создана.";
        };
    }
}
