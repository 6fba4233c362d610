package com.sheroshayari.auth.controller;

import com.sheroshayari.auth.dto.ForgotPasswordRequest;
import com.sheroshayari.auth.dto.LoginRequest;
import com.sheroshayari.auth.dto.LoginResponse;
import com.sheroshayari.auth.dto.MessageResponse;
import com.sheroshayari.auth.dto.RegisterRequest;
import com.sheroshayari.auth.dto.RegisterResponse;
import com.sheroshayari.auth.dto.ResetPasswordRequest;
import com.sheroshayari.auth.dto.SessionInfoResponse;
import com.sheroshayari.auth.entity.UserAccount;
import com.sheroshayari.auth.security.TokenClaims;
import com.sheroshayari.auth.service.AuthOutcome;
import com.sheroshayari.auth.service.AuthService;
import com.sheroshayari.auth.service.LoginResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for the SheroShayari credential lifecycle.
 *
 * Endpoints:
 * - POST /api/auth/register              - Create account, send confirmation email
 * - GET  /api/auth/confirm-email         - Confirm email from the emailed link
 * - POST /api/auth/login                 - Check credentials, return bearer token
 * - POST /api/auth/forgot-password       - Send password reset link
 * - GET  /api/auth/validate-reset-token  - Pre-check a reset link
 * - POST /api/auth/reset-password        - Set a new password with a reset code
 * - POST /api/auth/logout                - Acknowledge logout (requires auth)
 * - GET  /api/auth/session               - Current session info (requires auth)
 *
 * Error Handling:
 * - Every failure is an {@link com.sheroshayari.auth.service.AuthError}; its
 *   HTTP status and message are applied here
 * - Body validation failures are answered by
 *   {@link com.sheroshayari.auth.web.GlobalExceptionHandler}
 *
 * @see AuthService for business logic
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    /** Service layer for authentication business logic */
    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthOutcome<String> outcome = authService.register(
                request.getEmail(), request.getPassword(), request.getConfirmPassword(), request.getFullName());
        RegisterResponse body = RegisterResponse.builder()
                .success(outcome.isSuccess())
                .message(outcome.getMessage())
                .userId(outcome.getValue())
                .build();
        return respond(outcome, body);
    }

    /**
     * Target of the link in the confirmation email.
     *
     * @param userId id embedded in the link
     * @param code confirmation token embedded in the link
     */
    @GetMapping("/confirm-email")
    public ResponseEntity<MessageResponse> confirmEmail(
            @RequestParam(name = "userId", required = false) String userId,
            @RequestParam(name = "code", required = false) String code) {
        return respond(authService.confirmEmail(userId, code));
    }

    /**
     * Authenticate with email and password.
     *
     * Unknown email and wrong password both produce 401 with the same body.
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthOutcome<LoginResult> outcome = authService.login(request.getEmail(), request.getPassword());
        LoginResponse.LoginResponseBuilder body = LoginResponse.builder()
                .success(outcome.isSuccess())
                .message(outcome.getMessage());
        if (outcome.isSuccess()) {
            LoginResult result = outcome.getValue();
            body.accessToken(result.getToken().getToken())
                    .userId(result.getUserId())
                    .email(result.getEmail())
                    .expiresAt(result.getToken().getExpiresAt());
        }
        return respond(outcome, body.build());
    }

    /**
     * Always 200 with the same message, except 503 when the mail server
     * cannot be reached for an existing account.
     */
    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return respond(authService.forgotPassword(request.getEmail()));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return respond(authService.resetPassword(
                request.getEmail(), request.getToken(), request.getNewPassword(), request.getConfirmPassword()));
    }

    @GetMapping("/validate-reset-token")
    public ResponseEntity<MessageResponse> validateResetToken(
            @RequestParam(name = "email", required = false) String email,
            @RequestParam(name = "code", required = false) String code) {
        return respond(authService.validateResetToken(email, code));
    }

    /**
     * Logout the current user.
     *
     * Bearer tokens are stateless, so this is an acknowledgement only: the
     * client discards its token, which otherwise stays valid until expiry.
     */
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@AuthenticationPrincipal TokenClaims claims) {
        return respond(authService.logout(claims.getSubject()));
    }

    /**
     * Information about the current authenticated session.
     *
     * @param claims claims of the validated bearer token, injected by
     *               {@link com.sheroshayari.auth.web.JwtAuthenticationFilter}
     */
    @GetMapping("/session")
    public ResponseEntity<?> getSession(@AuthenticationPrincipal TokenClaims claims) {
        AuthOutcome<UserAccount> outcome = authService.currentUser(claims.getSubject());
        if (!outcome.isSuccess()) {
            return respond(outcome);
        }
        UserAccount user = outcome.getValue();
        return ResponseEntity.ok(SessionInfoResponse.builder()
                .userId(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .emailConfirmed(user.isEmailConfirmed())
                .expiresAt(claims.getExpiresAt())
                .build());
    }

    private static ResponseEntity<MessageResponse> respond(AuthOutcome<?> outcome) {
        return respond(outcome, new MessageResponse(outcome.isSuccess(), outcome.getMessage()));
    }

    private static <B> ResponseEntity<B> respond(AuthOutcome<?> outcome, B body) {
        if (outcome.isSuccess()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(outcome.getError().status()).body(body);
    }
}
