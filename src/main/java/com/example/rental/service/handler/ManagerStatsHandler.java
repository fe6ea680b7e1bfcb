package com.example.rental.service.handler;

import com.example.rental.dto.IncomingUpdate;
import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.model.SyncTaskStatus;
import com.example.rental.model.User;
import com.example.rental.service.BookingService;
import com.example.rental.service.ChatSender;
import com.example.rental.service.UserExportService;
import com.example.rental.service.UserService;
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.util.KeyboardUtil;
import com.example.rental.store.SyncQueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ManagerStatsHandler {

    private final ChatSender sender;
    private final UserService userService;
    private final BookingService bookingService;
    private final UserExportService exportService;
    private final SyncQueueStore syncQueue;
    private final Clock clock;

    public void showStats(IncomingUpdate u) {
        LocalDate today = LocalDate.now(clock);
        List<Booking> lastMonth = bookingService.bookingsInRange(today.minusDays(29), today);

        StringBuilder sb = new StringBuilder("📈 Статистика\n\n");
        List<User> users = userService.allUsers();
        sb.append("👥 Пользователи: ").append(users.size()).append('\n');
        sb.append("Менеджеры: ").append(users.stream().filter(User::isManager).count())
                .append(", в черном списке: ").append(users.stream().filter(User::isBlacklisted).count()).append('\n');
        sb.append("Активны за 7 дней: ").append(userService.activeUsers(7).size()).append('\n');
        sb.append("Активны за 30 дней: ").append(userService.activeUsers(30).size()).append("\n\n");
        appendPeriod(sb, "Сегодня", lastMonth, today);
        appendPeriod(sb, "За 7 дней", lastMonth, today.minusDays(6));
        appendPeriod(sb, "За 30 дней", lastMonth, today.minusDays(29));
        long failed = syncQueue.countByStatus(SyncTaskStatus.FAILED);
        sb.append("🔄 Синхронизация: в очереди ").append(syncQueue.countOpen())
                .append(", с ошибкой ").append(failed);

        sender.send(u.chatId(), sb.toString(),
                KeyboardUtil.single("📥 Экспорт пользователей", CallbackData.EXPORT_USERS_DATA));
    }

    public void exportUsers(IncomingUpdate u) {
        Path file = exportService.exportUsers();
        try {
            sender.sendDocument(u.chatId(), file.toFile(), "👥 Пользователи");
        } finally {
            exportService.discard(file);
        }
    }

    static Map<BookingStatus, Long> countByStatus(List<Booking> bookings, LocalDate from) {
        Map<BookingStatus, Long> counts = new EnumMap<>(BookingStatus.class);
        for (Booking b : bookings) {
            if (!b.getDate().isBefore(from)) {
                counts.merge(b.getStatus(), 1L, Long::sum);
            }
        }
        return counts;
    }

    private static void appendPeriod(StringBuilder sb, String title, List<Booking> bookings, LocalDate from) {
        Map<BookingStatus, Long> counts = countByStatus(bookings, from);
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        sb.append("📋 ").append(title).append(": ").append(total).append('\n');
        counts.forEach((status, n) -> sb.append("   ").append(status.label()).append(": ").append(n).append('\n'));
        sb.append('\n');
    }
}
