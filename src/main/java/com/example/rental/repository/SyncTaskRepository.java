package com.example.rental.repository;

import com.example.rental.model.SyncTask;
import com.example.rental.model.SyncTaskStatus;
import com.example.rental.model.SyncTaskType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface SyncTaskRepository extends JpaRepository<SyncTask, Long> {

    @Query("""
            select t from SyncTask t
            where t.taskType = :type and t.status in :statuses
              and (t.nextRetryAt is null or t.nextRetryAt <= :now)
            order by t.id
            """)
    List<SyncTask> findDue(@Param("type") SyncTaskType type,
                           @Param("statuses") Collection<SyncTaskStatus> statuses,
                           @Param("now") LocalDateTime now,
                           Pageable pageable);

    @Query("""
            select case when count(t) > 0 then true else false end from SyncTask t
            where t.bookingId = :bookingId and t.id < :id and t.status in :statuses
            """)
    boolean existsEarlierOpen(@Param("bookingId") Long bookingId,
                              @Param("id") Long id,
                              @Param("statuses") Collection<SyncTaskStatus> statuses);

    boolean existsByTaskTypeAndStatusIn(SyncTaskType type, Collection<SyncTaskStatus> statuses);

    List<SyncTask> findByStatusOrderByIdDesc(SyncTaskStatus status, Pageable pageable);

    long countByStatus(SyncTaskStatus status);

    long countByStatusIn(Collection<SyncTaskStatus> statuses);
}
