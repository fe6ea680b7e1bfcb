package com.example.rental.store;

import com.example.rental.model.SyncTask;
import com.example.rental.model.SyncTaskStatus;
import com.example.rental.model.SyncTaskType;
import com.example.rental.repository.SyncTaskRepository;
import com.example.rental.service.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Outbox of mirror writes ({@code sync_queue}).
 */
@Slf4j
@Component
public class SyncQueueStore extends AbstractStore {

    private final SyncTaskRepository taskRepo;

    public SyncQueueStore(SyncTaskRepository taskRepo, PlatformTransactionManager txManager, Clock clock) {
        super(txManager, clock);
        this.taskRepo = taskRepo;
    }

    /**
     * Appends a task. Whole-sheet kinds are skipped while an open row of the same kind
     * exists, since that row will rewrite the sheet anyway.
     *
     * @return the stored task, empty when coalesced
     */
    public Optional<SyncTask> enqueueTask(SyncTaskType type, Long bookingId, String payload, String bookingStatus) {
        return write("enqueueTask", () -> {
            if (!type.isPerBooking() && taskRepo.existsByTaskTypeAndStatusIn(type, SyncTaskStatus.OPEN)) {
                log.debug("Skip {} task: an open one is already queued", type);
                return Optional.<SyncTask>empty();
            }
            SyncTask task = SyncTask.create(type, bookingId, payload, bookingStatus, now());
            return Optional.of(taskRepo.save(task));
        });
    }

    /** Open tasks of the kind whose retry time has come, oldest first. */
    public List<SyncTask> leaseDuePendingTasks(SyncTaskType type, int limit, LocalDateTime now) {
        return read("leaseDuePendingTasks",
                () -> taskRepo.findDue(type, SyncTaskStatus.OPEN, now, PageRequest.of(0, limit)));
    }

    /** An older open task of the same booking must be delivered first. */
    public boolean hasEarlierOpenTask(SyncTask task) {
        if (task.getBookingId() == null) return false;
        return read("hasEarlierOpenTask",
                () -> taskRepo.existsEarlierOpen(task.getBookingId(), task.getId(), SyncTaskStatus.OPEN));
    }

    public void markCompleted(Long id) {
        update(id, t -> t.markCompleted(now()));
    }

    public void markRetry(Long id, LocalDateTime nextAt, String error) {
        update(id, t -> t.markRetry(nextAt, error));
    }

    public void markFailed(Long id, String error) {
        update(id, t -> t.markFailed(now(), error));
    }

    public List<SyncTask> listFailed(int limit) {
        return read("listFailed",
                () -> taskRepo.findByStatusOrderByIdDesc(SyncTaskStatus.FAILED, PageRequest.of(0, limit)));
    }

    public long countByStatus(SyncTaskStatus status) {
        return read("countByStatus", () -> taskRepo.countByStatus(status));
    }

    public long countOpen() {
        return read("countOpen", () -> taskRepo.countByStatusIn(SyncTaskStatus.OPEN));
    }

    private void update(Long id, Consumer<SyncTask> change) {
        writeVoid("updateTask", () -> {
            SyncTask task = taskRepo.findById(id).orElseThrow(() -> new NotFoundException("SyncTask", id));
            change.accept(task);
            taskRepo.save(task);
        });
    }
}
