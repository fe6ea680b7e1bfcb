package com.example.rental.store;

import com.example.rental.model.User;
import com.example.rental.repository.UserRepository;
import com.example.rental.service.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class UserStore extends AbstractStore {

    private final UserRepository userRepo;

    public UserStore(UserRepository userRepo, PlatformTransactionManager txManager, Clock clock) {
        super(txManager, clock);
        this.userRepo = userRepo;
    }

    /**
     * Inserts or updates the user keyed by its Telegram id. Profile fields and flags are
     * overwritten; a stored phone is kept when the incoming one is empty.
     */
    public User upsertUser(User incoming) {
        try {
            return write("upsertUser", () -> doUpsert(incoming));
        } catch (StorageException e) {
            if (!(e.getCause() instanceof DataIntegrityViolationException)) throw e;
            // concurrent first contact inserted the row; the second attempt updates it
            log.debug("upsertUser retry for telegramId={}", incoming.getTelegramId());
            return write("upsertUser", () -> doUpsert(incoming));
        }
    }

    private User doUpsert(User incoming) {
        LocalDateTime now = now();
        User user = userRepo.findByTelegramId(incoming.getTelegramId()).orElseGet(() -> {
            User created = new User();
            created.setTelegramId(incoming.getTelegramId());
            created.setCreatedAt(now);
            return created;
        });
        user.setUsername(incoming.getUsername());
        user.setFirstName(incoming.getFirstName());
        user.setLastName(incoming.getLastName());
        if (incoming.getPhone() != null && !incoming.getPhone().isBlank()) {
            user.setPhone(incoming.getPhone());
        }
        user.setManager(incoming.isManager());
        user.setBlacklisted(incoming.isBlacklisted());
        user.setLanguageCode(incoming.getLanguageCode());
        user.setLastActivity(now);
        user.setUpdatedAt(now);
        return userRepo.saveAndFlush(user);
    }

    public Optional<User> getUserByPlatformId(Long telegramId) {
        return read("getUserByPlatformId", () -> userRepo.findByTelegramId(telegramId));
    }

    public Optional<User> getUserById(Long id) {
        return read("getUserById", () -> userRepo.findById(id));
    }

    /** Most recently active first. */
    public List<User> listAllUsers() {
        return read("listAllUsers", userRepo::findAllByOrderByLastActivityDesc);
    }

    public List<User> listActiveUsersSince(int days) {
        LocalDateTime since = now().minusDays(days);
        return read("listActiveUsersSince", () -> userRepo.findByLastActivityAfterOrderByLastActivityDesc(since));
    }

    public boolean updateUserPhone(Long telegramId, String phone) {
        return write("updateUserPhone", () -> userRepo.updatePhone(telegramId, phone, now()) > 0);
    }

    public boolean touchUserActivity(Long telegramId) {
        return write("touchUserActivity", () -> userRepo.touchActivity(telegramId, now()) > 0);
    }
}
