package com.sheroshayari.auth.store;

import com.sheroshayari.auth.entity.UserAccount;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link CredentialStore} for service tests.
 * Keyed by normalized email, so putIfAbsent plays the role of the unique index.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, UserAccount> byEmail = new ConcurrentHashMap<>();

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        return Optional.ofNullable(byEmail.get(JpaCredentialStore.normalizeEmail(email)));
    }

    @Override
    public Optional<UserAccount> findById(String userId) {
        return byEmail.values().stream().filter(u -> u.getId().equals(userId)).findFirst();
    }

    @Override
    public Optional<UserAccount> create(String email, String passwordHash, String fullName) {
        String normalized = JpaCredentialStore.normalizeEmail(email);
        UserAccount account = UserAccount.builder()
                .id(UUID.randomUUID().toString())
                .email(normalized)
                .passwordHash(passwordHash)
                .fullName(fullName)
                .securityStamp(UserAccount.newSecurityStamp())
                .createdAt(LocalDateTime.now())
                .build();
        return byEmail.putIfAbsent(normalized, account) == null ? Optional.of(account) : Optional.empty();
    }

    @Override
    public synchronized Optional<UserAccount> updatePassword(
            String userId, String expectedStamp, String newPasswordHash) {
        return findById(userId)
                .filter(account -> account.getSecurityStamp().equals(expectedStamp))
                .map(account -> {
                    account.setPasswordHash(newPasswordHash);
                    account.rotateSecurityStamp();
                    return account;
                });
    }

    @Override
    public Optional<UserAccount> confirmEmail(String userId) {
        return findById(userId).map(account -> {
            account.setEmailConfirmed(true);
            return account;
        });
    }

    public int size() {
        return byEmail.size();
    }
}
