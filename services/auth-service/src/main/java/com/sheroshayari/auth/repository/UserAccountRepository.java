package com.sheroshayari.auth.repository;

import com.sheroshayari.auth.entity.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * UserAccountRepository - Spring Data JPA repository for {@link UserAccount}.
 *
 * Only used through {@link com.sheroshayari.auth.store.JpaCredentialStore};
 * the orchestrator never talks to JPA directly.
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    /**
     * Find a user by email address, ignoring case.
     *
     * Query: SELECT * FROM users WHERE lower(email) = lower(:email)
     *
     * @param email The email address to search for
     * @return Optional containing the account if found, empty Optional if not
     */
    Optional<UserAccount> findByEmailIgnoreCase(String email);

    /**
     * Check if an account with the given email already exists, ignoring case.
     *
     * @param email The email address to check
     * @return true if an account with this email exists
     */
    boolean existsByEmailIgnoreCase(String email);

    /**
     * Replace the password hash and security stamp, but only while the row still
     * carries {@code expectedStamp}.
     *
     * Query: UPDATE users SET password_hash = :hash, security_stamp = :newStamp
     *        WHERE id = :id AND security_stamp = :expectedStamp
     *
     * @return number of rows changed, 0 when the id is unknown or the stamp has moved on
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserAccount u set u.passwordHash = :hash, u.securityStamp = :newStamp, u.updatedAt = :now "
            + "where u.id = :id and u.securityStamp = :expectedStamp")
    int updatePasswordIfStampMatches(
            @Param("id") String id,
            @Param("expectedStamp") String expectedStamp,
            @Param("hash") String hash,
            @Param("newStamp") String newStamp,
            @Param("now") LocalDateTime now);
}
