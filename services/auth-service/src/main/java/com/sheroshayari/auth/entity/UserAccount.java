package com.sheroshayari.auth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * UserAccount - JPA entity for a registered SheroShayari user.
 *
 * Holds the credential state the auth workflow operates on: the normalized
 * email used for lookup, the BCrypt password hash, the email confirmation flag
 * and the security stamp that scopes every purpose token (email confirmation,
 * password reset) issued for this account.
 *
 * Database Table: users
 *
 * Lifecycle:
 * - Created on registration (emailConfirmed = false)
 * - Mutated on email confirmation and password reset
 * - Never hard-deleted by the auth service
 *
 * @see com.sheroshayari.auth.store.CredentialStore for write semantics
 */
@Entity
@Table(name = "users")
@Data  // Lombok: generates getters, setters, equals, hashCode, toString
@NoArgsConstructor  // Lombok: required by JPA for entity instantiation
@AllArgsConstructor  // Lombok: enables builder pattern
@Builder  // Lombok: enables fluent builder API for object construction
public class UserAccount {

    /**
     * Unique identifier for the user, a random UUID in string form.
     *
     * Immutable once created; it is embedded in confirmation links and
     * in the "sub" claim of every bearer token.
     */
    @Id
    @Column(name = "id", length = 36, nullable = false, updatable = false)
    private String id;

    /**
     * Email address, stored trimmed and lower-cased.
     *
     * Because every write goes through normalization, the unique constraint
     * on this column enforces case-insensitive uniqueness and is the only
     * arbiter when two registrations for the same address race.
     */
    @Column(name = "email", unique = true, nullable = false, length = 256)
    private String email;

    /**
     * BCrypt hash of the password. The plaintext is never stored or logged.
     */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    /**
     * Whether the user followed the confirmation link sent at registration.
     */
    @Column(name = "email_confirmed", nullable = false)
    private boolean emailConfirmed;

    /**
     * Display name, carried in the "name" claim of bearer tokens.
     * Defaults to the email when the user does not supply one.
     */
    @Column(name = "full_name", length = 256)
    private String fullName;

    /**
     * Random value rotated whenever the credentials change.
     *
     * Purpose tokens are derived from it, so rotating the stamp invalidates
     * every confirmation and reset token previously issued for the account.
     */
    @ToString.Exclude
    @Column(name = "security_stamp", nullable = false, length = 64)
    private String securityStamp;

    /**
     * Timestamp when the account was created.
     */
    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Timestamp when the account was last modified.
     */
    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * JPA lifecycle callback executed before INSERT.
     *
     * Ensures id and security stamp are present even when the entity is built
     * without them.
     */
    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (securityStamp == null) {
            securityStamp = newSecurityStamp();
        }
    }

    /**
     * Replace the security stamp with a fresh random value.
     */
    public void rotateSecurityStamp() {
        this.securityStamp = newSecurityStamp();
    }

    public static String newSecurityStamp() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
