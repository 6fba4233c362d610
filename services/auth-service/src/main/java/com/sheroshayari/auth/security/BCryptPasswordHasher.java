package com.sheroshayari.auth.security;

import com.sheroshayari.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * BCryptPasswordHasher - {@link PasswordHasher} over Spring Security's BCrypt encoder.
 *
 * The work factor comes from {@code auth.password.bcrypt-strength}. BCrypt embeds
 * the per-call salt and the cost in the hash string and compares digests in
 * constant time.
 *
 * BCrypt only reads the first 72 bytes of its input, so longer passwords are
 * refused by {@link #hash} and never verify.
 */
@Component
@Slf4j
public class BCryptPasswordHasher implements PasswordHasher {

    static final int MAX_PASSWORD_BYTES = 72;

    private final BCryptPasswordEncoder encoder;

    @Autowired
    public BCryptPasswordHasher(AuthProperties properties) {
        this(properties.password().bcryptStrength());
    }

    public BCryptPasswordHasher(int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    @Override
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        if (exceedsLimit(plaintext)) {
            throw new IllegalArgumentException("Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return encoder.encode(plaintext);
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isEmpty() || exceedsLimit(plaintext)) {
            return false;
        }
        try {
            return encoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected malformed password hash: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public int maxPasswordBytes() {
        return MAX_PASSWORD_BYTES;
    }

    private static boolean exceedsLimit(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
