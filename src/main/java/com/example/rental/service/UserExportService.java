package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.model.User;
import com.example.rental.service.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the user directory to a CSV file under {@code exports.path}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserExportService {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter CELL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String HEADER = "telegram_id,username,first_name,last_name,phone,is_manager,is_blacklisted,last_activity,created_at";

    private final UserService userService;
    private final BotConfig config;
    private final Clock clock;

    public Path exportUsers() {
        List<User> users = userService.allUsers();
        Path dir = Path.of(config.getExportsPath());
        Path file = dir.resolve("users_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".csv");
        try {
            Files.createDirectories(dir);
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                // BOM so spreadsheet tools pick UTF-8 for Cyrillic names
                out.write('\uFEFF');
                out.write(HEADER);
                out.write('\n');
                for (User user : users) {
                    out.write(toRow(user));
                    out.write('\n');
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write user export " + file, e);
        }
        log.info("Exported {} users to {}", users.size(), file);
        return file;
    }

    /** Removes a delivered export; a leftover file is only logged. */
    public void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete export {}: {}", file, e.getMessage());
        }
    }

    static String toRow(User user) {
        return String.join(",",
                cell(user.getTelegramId()),
                cell(user.getUsername()),
                cell(user.getFirstName()),
                cell(user.getLastName()),
                cell(user.getPhone()),
                cell(user.isManager()),
                cell(user.isBlacklisted()),
                cell(user.getLastActivity() == null ? null : user.getLastActivity().format(CELL_TIME)),
                cell(user.getCreatedAt() == null ? null : user.getCreatedAt().format(CELL_TIME)));
    }

    static String cell(Object value) {
        if (value == null) return "";
        String s = value.toString();
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
