package com.example.rental.repository;

import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    @Query("""
            select count(b) from Booking b
            where b.itemId = :itemId and b.date = :date and b.status in :statuses
            """)
    long countByItemAndDate(@Param("itemId") Long itemId,
                            @Param("date") LocalDate date,
                            @Param("statuses") Collection<BookingStatus> statuses);

    @Query("""
            select b.date, count(b) from Booking b
            where b.itemId = :itemId and b.date between :start and :end and b.status in :statuses
            group by b.date
            """)
    List<Object[]> countPerDay(@Param("itemId") Long itemId,
                               @Param("start") LocalDate start,
                               @Param("end") LocalDate end,
                               @Param("statuses") Collection<BookingStatus> statuses);

    @Query("""
            select count(b) from Booking b
            where b.itemId = :itemId and b.date >= :from and b.status in :statuses
            group by b.date
            order by count(b) desc
            """)
    List<Long> findDailyCountsDesc(@Param("itemId") Long itemId,
                                   @Param("from") LocalDate from,
                                   @Param("statuses") Collection<BookingStatus> statuses);

    List<Booking> findByDateBetweenOrderByDateAscIdAsc(LocalDate start, LocalDate end);

    List<Booking> findByUserIdAndDateGreaterThanEqualOrderByDateAscIdAsc(Long userId, LocalDate from);

    List<Booking> findByDateAndStatusInOrderByIdAsc(LocalDate date, Collection<BookingStatus> statuses);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Booking b
            set b.status = :newStatus, b.version = b.version + 1, b.updatedAt = :now
            where b.id = :id and b.version = :expectedVersion and b.status in :from
            """)
    int updateStatusWithVersion(@Param("id") Long id,
                                @Param("expectedVersion") long expectedVersion,
                                @Param("from") Collection<BookingStatus> from,
                                @Param("newStatus") BookingStatus newStatus,
                                @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Booking b
            set b.itemId = :itemId, b.itemName = :itemName, b.status = :newStatus,
                b.version = b.version + 1, b.updatedAt = :now
            where b.id = :id and b.version = :expectedVersion and b.status in :from
            """)
    int updateItemAndStatusWithVersion(@Param("id") Long id,
                                       @Param("expectedVersion") long expectedVersion,
                                       @Param("from") Collection<BookingStatus> from,
                                       @Param("itemId") Long itemId,
                                       @Param("itemName") String itemName,
                                       @Param("newStatus") BookingStatus newStatus,
                                       @Param("now") LocalDateTime now);
}
