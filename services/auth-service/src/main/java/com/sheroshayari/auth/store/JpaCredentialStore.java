package com.sheroshayari.auth.store;

import com.sheroshayari.auth.entity.UserAccount;
import com.sheroshayari.auth.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * JpaCredentialStore - {@link CredentialStore} backed by {@link UserAccountRepository}.
 *
 * Emails are normalized (trimmed, lower-cased) before every read and write so
 * that the unique index on users.email enforces case-insensitive uniqueness.
 *
 * Transaction Behavior:
 * - create: runs in the repository's own transaction so a unique-constraint
 *   violation can be caught here and reported as a duplicate
 * - updatePassword: one conditional UPDATE keyed on id and the expected security stamp
 * - confirmEmail: single-row read-modify-write in one transaction
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCredentialStore implements CredentialStore {

    private final UserAccountRepository userAccountRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findByEmail(String email) {
        String normalized = normalizeEmail(email);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return userAccountRepository.findByEmailIgnoreCase(normalized);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return userAccountRepository.findById(userId.trim());
    }

    @Override
    public Optional<UserAccount> create(String email, String passwordHash, String fullName) {
        String normalized = normalizeEmail(email);
        if (userAccountRepository.existsByEmailIgnoreCase(normalized)) {
            return Optional.empty();
        }

        UserAccount account = UserAccount.builder()
                .id(UUID.randomUUID().toString())
                .email(normalized)
                .passwordHash(passwordHash)
                .emailConfirmed(false)
                .fullName(fullName)
                .securityStamp(UserAccount.newSecurityStamp())
                .build();
        try {
            return Optional.of(userAccountRepository.saveAndFlush(account));
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent registration for the same email.
            log.info("Unique constraint rejected account for email: {}", sanitize(normalized));
            return Optional.empty();
        }
    }

    @Override
    @Transactional
    public Optional<UserAccount> updatePassword(String userId, String expectedStamp, String newPasswordHash) {
        if (userId == null || expectedStamp == null) {
            return Optional.empty();
        }
        int updated = userAccountRepository.updatePasswordIfStampMatches(
                userId.trim(), expectedStamp, newPasswordHash, UserAccount.newSecurityStamp(), LocalDateTime.now());
        if (updated == 0) {
            log.info("Password update skipped for user {}: security stamp changed", userId);
            return Optional.empty();
        }
        return userAccountRepository.findById(userId.trim());
    }

    @Override
    @Transactional
    public Optional<UserAccount> confirmEmail(String userId) {
        return findById(userId).map(account -> {
            account.setEmailConfirmed(true);
            return userAccountRepository.save(account);
        });
    }

    static String normalizeEmail(String email) {
        if (email == null) return "";
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String sanitize(String value) {
        return value.replace("\r", "").replace("\n", "");
    }
}
