package com.sheroshayari.auth.store;

import com.sheroshayari.auth.entity.UserAccount;

import java.util.Optional;

/**
 * Persistence boundary for user credentials.
 *
 * Every lookup and mutation returns the affected account, or an empty Optional
 * when no such account exists. Emails are matched case-insensitively.
 */
public interface CredentialStore {

    Optional<UserAccount> findByEmail(String email);

    Optional<UserAccount> findById(String userId);

    /**
     * Insert a new, unconfirmed account.
     *
     * @return the stored account, or empty when the email is already registered
     *         (including when a concurrent insert wins the unique constraint)
     */
    Optional<UserAccount> create(String email, String passwordHash, String fullName);

    /**
     * Store a new password hash and rotate the account's security stamp, provided
     * the stamp is still {@code expectedStamp}. Check and write are one atomic step,
     * so of two resets verified against the same stamp only one is applied.
     *
     * @return the updated account, or empty when the account is gone or its stamp
     *         no longer matches
     */
    Optional<UserAccount> updatePassword(String userId, String expectedStamp, String newPasswordHash);

    Optional<UserAccount> confirmEmail(String userId);
}
