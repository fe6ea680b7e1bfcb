package com.example.rental.repository;

import com.example.rental.model.Item;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ItemRepository extends JpaRepository<Item, Long> {

    List<Item> findByActiveTrueOrderBySortOrderAscNameAsc();

    Optional<Item> findFirstByNameIgnoreCaseAndActiveTrue(String name);

    @Query("select coalesce(max(i.sortOrder), 0) from Item i where i.active = true")
    int findMaxSortOrder();

    /** Row lock on the item; serialises capacity checks for all of its dates. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from Item i where i.id = :id")
    Optional<Item> findByIdForUpdate(@Param("id") Long id);
}
