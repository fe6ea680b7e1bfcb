package com.example.rental.repository;

import com.example.rental.model.RateLimitCounter;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface RateLimitCounterRepository extends JpaRepository<RateLimitCounter, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from RateLimitCounter c where c.userId = :userId")
    Optional<RateLimitCounter> findForUpdate(@Param("userId") Long userId);
}
