package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.IncomingUpdate;
import com.example.rental.model.User;
import com.example.rental.store.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Manager and blacklist membership comes from configuration; the persisted flags mirror it
 * on every save.
 */
@Slf4j
@Service
public class UserService {

    private final UserStore userStore;
    private final Set<Long> managers;
    private final Set<Long> blacklist;
    private final List<String> managerContacts;

    public UserService(UserStore userStore, BotConfig config) {
        this.userStore = userStore;
        this.managers = Set.copyOf(config.getManagers());
        this.blacklist = Set.copyOf(config.getBlacklist());
        this.managerContacts = List.copyOf(config.getManagersContacts());
        log.info("Loaded {} managers and {} blacklisted users", managers.size(), blacklist.size());
    }

    public boolean isManager(long telegramId) {
        return managers.contains(telegramId);
    }

    public boolean isBlacklisted(long telegramId) {
        return blacklist.contains(telegramId);
    }

    public Set<Long> managerIds() {
        return managers;
    }

    public List<String> managerContacts() {
        return managerContacts;
    }

    public User saveUser(IncomingUpdate update) {
        User user = new User();
        user.setTelegramId(update.userId());
        user.setUsername(update.username());
        user.setFirstName(update.firstName());
        user.setLastName(update.lastName());
        user.setLanguageCode(update.languageCode());
        return saveUser(user);
    }

    public User saveUser(User user) {
        user.setManager(isManager(user.getTelegramId()));
        user.setBlacklisted(isBlacklisted(user.getTelegramId()));
        return userStore.upsertUser(user);
    }

    /** Best effort; failures are only logged. */
    public void touchActivity(long telegramId) {
        try {
            userStore.touchUserActivity(telegramId);
        } catch (Exception e) {
            log.warn("Failed to update activity of user {}: {}", telegramId, e.getMessage());
        }
    }

    public void updatePhone(long telegramId, String phone) {
        userStore.updateUserPhone(telegramId, phone);
    }

    public Optional<User> findUser(long telegramId) {
        return userStore.getUserByPlatformId(telegramId);
    }

    public List<User> allUsers() {
        return userStore.listAllUsers();
    }

    public List<User> activeUsers(int days) {
        return userStore.listActiveUsersSince(days);
    }
}
