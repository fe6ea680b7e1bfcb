package com.example.rental.service;

import com.example.rental.service.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Stream;

/**
 * Online backups of the embedded database into {@code backup.path} using H2's {@code BACKUP TO},
 * with old archives removed after {@code backup.retention_days}.
 */
@Slf4j
@Component
public class DatabaseBackupService {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String PREFIX = "backup_";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final boolean enabled;
    private final Path dir;
    private final int retentionDays;

    public DatabaseBackupService(JdbcTemplate jdbcTemplate, Clock clock,
                                 @Value("${backup.enabled:false}") boolean enabled,
                                 @Value("${backup.path:./backups}") String path,
                                 @Value("${backup.retention_days:7}") int retentionDays) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.enabled = enabled;
        this.dir = Path.of(path);
        this.retentionDays = retentionDays;
    }

    @Scheduled(fixedDelayString = "${backup.interval_ms:86400000}", initialDelayString = "${backup.initial_delay_ms:60000}")
    public void scheduledBackup() {
        if (!enabled) {
            return;
        }
        try {
            performBackup();
            cleanupOldBackups();
        } catch (StorageException e) {
            log.error("Scheduled backup failed: {}", e.getMessage(), e);
        }
    }

    public Path performBackup() {
        Path file = dir.resolve(PREFIX + LocalDateTime.now(clock).format(FILE_STAMP) + ".zip");
        try {
            Files.createDirectories(dir);
            jdbcTemplate.execute("BACKUP TO '" + file.toAbsolutePath().toString().replace("'", "''") + "'");
        } catch (IOException | DataAccessException e) {
            throw new StorageException("Backup to " + file + " failed", e);
        }
        log.info("Database backed up to {}", file);
        return file;
    }

    /** @return number of archives deleted */
    public int cleanupOldBackups() {
        if (retentionDays <= 0 || !Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);
        List<Path> archives;
        try (Stream<Path> files = Files.list(dir)) {
            archives = files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(PREFIX))
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list backups in {}: {}", dir, e.getMessage());
            return 0;
        }
        int deleted = 0;
        for (Path archive : archives) {
            try {
                if (Files.getLastModifiedTime(archive).toInstant().isBefore(cutoff)) {
                    Files.delete(archive);
                    deleted++;
                    log.info("Deleted old backup {}", archive.getFileName());
                }
            } catch (IOException e) {
                log.warn("Failed to delete old backup {}: {}", archive, e.getMessage());
            }
        }
        return deleted;
    }
}
