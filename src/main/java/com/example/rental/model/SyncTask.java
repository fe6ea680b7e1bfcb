package com.example.rental.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Outbox row describing one write to the spreadsheet mirror.
 */
@Entity
@Table(name = "sync_queue", indexes = {
        @Index(name = "idx_sync_queue_due", columnList = "status, next_retry_at"),
        @Index(name = "idx_sync_queue_booking", columnList = "booking_id")
})
@Getter @Setter
@NoArgsConstructor
public class SyncTask {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SyncTaskType taskType;

    @Column(name = "booking_id")
    private Long bookingId;

    /** booking snapshot or window as JSON */
    @Lob
    @Column(columnDefinition = "CLOB")
    private String payload;

    @Column(length = 20)
    private String bookingStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncTaskStatus status;

    @Column(nullable = false)
    private int retryCount;

    @Column(length = 2000)
    private String lastError;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    public static SyncTask create(SyncTaskType type, Long bookingId, String payload, String bookingStatus,
                                  LocalDateTime now) {
        SyncTask task = new SyncTask();
        task.taskType = type;
        task.bookingId = bookingId;
        task.payload = payload;
        task.bookingStatus = bookingStatus;
        task.status = SyncTaskStatus.PENDING;
        task.retryCount = 0;
        task.createdAt = now;
        task.nextRetryAt = now;
        return task;
    }

    public void markCompleted(LocalDateTime now) {
        this.status = SyncTaskStatus.COMPLETED;
        this.processedAt = now;
        this.lastError = null;
    }

    public void markRetry(LocalDateTime nextAt, String error) {
        this.status = SyncTaskStatus.RETRY;
        this.retryCount++;
        this.nextRetryAt = nextAt;
        this.lastError = truncate(error);
    }

    public void markFailed(LocalDateTime now, String error) {
        this.status = SyncTaskStatus.FAILED;
        this.retryCount++;
        this.processedAt = now;
        this.lastError = truncate(error);
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() > 2000 ? error.substring(0, 2000) : error;
    }
}
