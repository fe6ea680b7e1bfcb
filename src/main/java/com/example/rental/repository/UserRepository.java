package com.example.rental.repository;

import com.example.rental.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByTelegramId(Long telegramId);

    List<User> findAllByOrderByLastActivityDesc();

    List<User> findByLastActivityAfterOrderByLastActivityDesc(LocalDateTime since);

    @Modifying
    @Query("update User u set u.phone = :phone, u.updatedAt = :now where u.telegramId = :telegramId")
    int updatePhone(@Param("telegramId") Long telegramId, @Param("phone") String phone,
                    @Param("now") LocalDateTime now);

    @Modifying
    @Query("update User u set u.lastActivity = :now where u.telegramId = :telegramId")
    int touchActivity(@Param("telegramId") Long telegramId, @Param("now") LocalDateTime now);
}
