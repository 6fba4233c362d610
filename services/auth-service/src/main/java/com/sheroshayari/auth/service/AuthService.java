package com.sheroshayari.auth.service;

import com.sheroshayari.auth.config.AuthProperties;
import com.sheroshayari.auth.email.AuthEmailTemplates;
import com.sheroshayari.auth.email.EmailDeliveryException;
import com.sheroshayari.auth.email.EmailSender;
import com.sheroshayari.auth.entity.UserAccount;
import com.sheroshayari.auth.security.IssuedToken;
import com.sheroshayari.auth.security.PasswordHasher;
import com.sheroshayari.auth.security.PurposeTokenService;
import com.sheroshayari.auth.security.TokenIssuer;
import com.sheroshayari.auth.security.TokenPurpose;
import com.sheroshayari.auth.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * AuthService - Core business logic of the SheroShayari credential lifecycle.
 *
 * Sequences the credential store, password hasher, bearer token issuer and
 * purpose token service into the register / confirm / login / forgot / reset
 * flows exposed by {@link com.sheroshayari.auth.controller.AuthController}.
 *
 * Key Responsibilities:
 * - Account creation with hashed password and confirmation email
 * - Credential checks and JWT issuance
 * - Password reset through single-purpose tokens bound to the security stamp
 *
 * Anti-enumeration:
 * - Login answers INVALID_CREDENTIALS for both unknown email and wrong password
 * - Forgot-password answers the same generic success for unknown and known emails
 *
 * Error Handling:
 * - Expected failures are returned as {@link AuthOutcome} values
 * - Any other exception from a collaborator is logged here and mapped to UNEXPECTED
 *
 * @see CredentialStore for persistence
 * @see PurposeTokenService for confirmation and reset tokens
 */
@Service
@Slf4j
public class AuthService {

    static final String REGISTERED = "Registration successful. Please check your email to confirm your account.";
    static final String EMAIL_CONFIRMED = "Email confirmed successfully. You can now log in.";
    static final String LOGGED_IN = "Login successful.";
    static final String RESET_REQUESTED =
            "If an account with that email exists, you will receive a password reset email shortly.";
    static final String TOKEN_VALID = "Token is valid.";
    static final String PASSWORD_RESET =
            "Your password has been reset successfully. You can now log in with your new password.";
    static final String LOGGED_OUT = "Logged out successfully.";

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final TokenIssuer tokenIssuer;
    private final PurposeTokenService purposeTokens;
    private final EmailSender emailSender;
    private final AuthEmailTemplates emailTemplates;
    private final AuthProperties properties;
    private final Duration accessTokenTtl;

    /** Verified against on unknown emails so both login failure paths cost one hash check. */
    private final String decoyHash;

    public AuthService(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            TokenIssuer tokenIssuer,
            PurposeTokenService purposeTokens,
            EmailSender emailSender,
            AuthEmailTemplates emailTemplates,
            AuthProperties properties,
            @Value("${jwt.expiration-minutes:60}") long accessTokenMinutes) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.tokenIssuer = tokenIssuer;
        this.purposeTokens = purposeTokens;
        this.emailSender = emailSender;
        this.emailTemplates = emailTemplates;
        this.properties = properties;
        this.accessTokenTtl = Duration.ofMinutes(accessTokenMinutes);
        this.decoyHash = passwordHasher.hash("decoy-password-never-matches");
    }

    /**
     * Create an unconfirmed account and send the confirmation email.
     *
     * A failed email dispatch is logged and otherwise ignored: the account
     * exists and the caller still gets success.
     *
     * @return the new user's id
     */
    public AuthOutcome<String> register(String email, String password, String confirmPassword, String fullName) {
        return guarded("registration", () -> {
            if (password == null || !password.equals(confirmPassword)) {
                return AuthOutcome.failure(AuthError.PASSWORD_MISMATCH);
            }
            Optional<String> policyViolation = checkPasswordPolicy(password);
            if (policyViolation.isPresent()) {
                return AuthOutcome.failure(AuthError.VALIDATION_ERROR, policyViolation.get());
            }
            if (isBlank(email)) {
                return AuthOutcome.failure(AuthError.VALIDATION_ERROR, "Email is required.");
            }

            String displayName = isBlank(fullName) ? email.trim() : fullName.trim();
            Optional<UserAccount> created = credentialStore.create(email, passwordHasher.hash(password), displayName);
            if (created.isEmpty()) {
                log.warn("Registration rejected, email already registered: {}", sanitize(email));
                return AuthOutcome.failure(AuthError.DUPLICATE_EMAIL);
            }

            UserAccount user = created.get();
            sendConfirmationEmail(user);
            log.info("User {} registered successfully", user.getId());
            return AuthOutcome.success(user.getId(), REGISTERED);
        });
    }

    /**
     * Mark the account's email as confirmed if the code is a valid
     * confirmation token for it.
     */
    public AuthOutcome<Void> confirmEmail(String userId, String code) {
        return guarded("email confirmation", () -> {
            if (isBlank(userId) || isBlank(code)) {
                return AuthOutcome.failure(AuthError.VALIDATION_ERROR, "Invalid email confirmation request.");
            }
            Optional<UserAccount> user = credentialStore.findById(userId);
            if (user.isEmpty()) {
                return AuthOutcome.failure(AuthError.USER_NOT_FOUND);
            }
            if (!purposeTokens.verify(user.get(), TokenPurpose.EMAIL_CONFIRMATION, code)) {
                log.warn("Invalid email confirmation token for user {}", userId);
                return AuthOutcome.failure(AuthError.INVALID_TOKEN);
            }
            credentialStore.confirmEmail(userId);
            log.info("Email confirmed for user {}", userId);
            return AuthOutcome.success(EMAIL_CONFIRMED);
        });
    }

    /**
     * Check credentials and issue a bearer token.
     *
     * Unknown email and wrong password produce the identical failure.
     */
    public AuthOutcome<LoginResult> login(String email, String password) {
        return guarded("login", () -> {
            Optional<UserAccount> found = credentialStore.findByEmail(email);
            if (found.isEmpty()) {
                passwordHasher.verify(password, decoyHash);
                log.warn("Failed login attempt for {}", sanitize(email));
                return AuthOutcome.failure(AuthError.INVALID_CREDENTIALS);
            }
            UserAccount user = found.get();
            if (!passwordHasher.verify(password, user.getPasswordHash())) {
                log.warn("Failed login attempt for {}", sanitize(email));
                return AuthOutcome.failure(AuthError.INVALID_CREDENTIALS);
            }
            if (properties.requireConfirmedEmail() && !user.isEmailConfirmed()) {
                return AuthOutcome.failure(AuthError.EMAIL_NOT_CONFIRMED);
            }

            IssuedToken token = tokenIssuer.issue(user.getId(), user.getEmail(), user.getFullName(), accessTokenTtl);
            log.info("User {} logged in successfully", user.getId());
            return AuthOutcome.success(new LoginResult(user.getId(), user.getEmail(), token), LOGGED_IN);
        });
    }

    /**
     * Send a password reset link if the account exists.
     *
     * The response is the same generic success whether or not the email is
     * registered. The one exception is an email transport failure for an
     * existing account, which is reported as EMAIL_SERVICE_UNAVAILABLE unless
     * {@code auth.forgot-password.suppress-email-failures} is set.
     */
    public AuthOutcome<Void> forgotPassword(String email) {
        return guarded("forgot password", () -> {
            if (isBlank(email)) {
                return AuthOutcome.failure(AuthError.VALIDATION_ERROR, "Email is required.");
            }
            Optional<UserAccount> found = credentialStore.findByEmail(email);
            if (found.isEmpty()) {
                log.warn("Forgot password request for non-existent user: {}", sanitize(email));
                return AuthOutcome.success(RESET_REQUESTED);
            }

            UserAccount user = found.get();
            String code = purposeTokens.generate(user, TokenPurpose.PASSWORD_RESET);
            String link = emailTemplates.resetLink(user.getEmail(), code);
            try {
                emailSender.sendEmail(user.getEmail(), AuthEmailTemplates.RESET_SUBJECT,
                        emailTemplates.resetBody(user.getFullName(), link));
                log.info("Password reset email sent for user {}", user.getId());
            } catch (EmailDeliveryException e) {
                log.error("Could not send password reset email for user {}", user.getId(), e);
                if (!properties.forgotPassword().suppressEmailFailures()) {
                    return AuthOutcome.failure(AuthError.EMAIL_SERVICE_UNAVAILABLE);
                }
            }
            return AuthOutcome.success(RESET_REQUESTED);
        });
    }

    /**
     * Read-only check of a reset code, used by the client before it shows the
     * new-password form.
     */
    public AuthOutcome<Void> validateResetToken(String email, String code) {
        return guarded("reset token validation", () -> {
            if (isBlank(email) || isBlank(code)) {
                return AuthOutcome.failure(AuthError.VALIDATION_ERROR, "Missing email or code.");
            }
            Optional<UserAccount> user = credentialStore.findByEmail(email);
            if (user.isEmpty()) {
                log.warn("Validate reset token: user not found for {}", sanitize(email));
                return AuthOutcome.failure(AuthError.INVALID_EMAIL);
            }
            if (!purposeTokens.verify(user.get(), TokenPurpose.PASSWORD_RESET, code)) {
                log.warn("Invalid or expired password reset token for user {}", user.get().getId());
                return AuthOutcome.failure(AuthError.INVALID_OR_EXPIRED_TOKEN);
            }
            return AuthOutcome.success(TOKEN_VALID);
        });
    }

    /**
     * Replace the password if the reset token verifies. Storing the new hash
     * rotates the security stamp, so this token and every other outstanding
     * token for the account stop verifying. The store only writes while the
     * stamp is still the one the token was checked against.
     */
    public AuthOutcome<Void> resetPassword(String email, String token, String newPassword, String confirmPassword) {
        return guarded("password reset", () -> {
            if (newPassword == null || !newPassword.equals(confirmPassword)) {
                return AuthOutcome.failure(AuthError.PASSWORD_MISMATCH);
            }
            Optional<String> policyViolation = checkPasswordPolicy(newPassword);
            if (policyViolation.isPresent()) {
                return AuthOutcome.failure(AuthError.VALIDATION_ERROR, policyViolation.get());
            }
            Optional<UserAccount> found = credentialStore.findByEmail(email);
            if (found.isEmpty()) {
                return AuthOutcome.failure(AuthError.INVALID_EMAIL);
            }
            UserAccount user = found.get();
            String verifiedStamp = user.getSecurityStamp();
            if (!purposeTokens.verify(user, TokenPurpose.PASSWORD_RESET, token)) {
                log.warn("Password reset rejected for user {}: invalid or expired token", user.getId());
                return AuthOutcome.failure(AuthError.INVALID_OR_EXPIRED_TOKEN);
            }
            String newHash = passwordHasher.hash(newPassword);
            if (credentialStore.updatePassword(user.getId(), verifiedStamp, newHash).isEmpty()) {
                log.warn("Password reset rejected for user {}: token already used", user.getId());
                return AuthOutcome.failure(AuthError.INVALID_OR_EXPIRED_TOKEN);
            }
            log.info("Password reset successful for user {}", user.getId());
            return AuthOutcome.success(PASSWORD_RESET);
        });
    }

    /**
     * Acknowledge a logout. Bearer tokens are not tracked server-side, so the
     * token stays valid until it expires; the client discards it.
     */
    public AuthOutcome<Void> logout(String userId) {
        log.info("User {} logged out", userId);
        return AuthOutcome.success(LOGGED_OUT);
    }

    /**
     * Current account state for the authenticated caller.
     */
    public AuthOutcome<UserAccount> currentUser(String userId) {
        return guarded("session lookup", () -> credentialStore.findById(userId)
                .map(user -> AuthOutcome.success(user, "Session is active."))
                .orElseGet(() -> AuthOutcome.failure(AuthError.USER_NOT_FOUND)));
    }

    private void sendConfirmationEmail(UserAccount user) {
        try {
            String code = purposeTokens.generate(user, TokenPurpose.EMAIL_CONFIRMATION);
            String link = emailTemplates.confirmationLink(user.getId(), code);
            emailSender.sendEmail(user.getEmail(), AuthEmailTemplates.CONFIRM_SUBJECT,
                    emailTemplates.confirmationBody(link));
        } catch (RuntimeException e) {
            log.error("Could not send confirmation email for user {}", user.getId(), e);
        }
    }

    private Optional<String> checkPasswordPolicy(String password) {
        int minLength = properties.password().minLength();
        if (password.length() < minLength) {
            return Optional.of("Password must be at least " + minLength + " characters.");
        }
        int maxBytes = passwordHasher.maxPasswordBytes();
        if (password.getBytes(StandardCharsets.UTF_8).length > maxBytes) {
            return Optional.of("Password must be at most " + maxBytes + " bytes long.");
        }
        return Optional.empty();
    }

    private <T> AuthOutcome<T> guarded(String operation, Supplier<AuthOutcome<T>> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.error("Error during {}", operation, e);
            return AuthOutcome.failure(AuthError.UNEXPECTED);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String sanitize(String value) {
        if (value == null) return "";
        return value.replace("\r", "").replace("\n", "");
    }
}
