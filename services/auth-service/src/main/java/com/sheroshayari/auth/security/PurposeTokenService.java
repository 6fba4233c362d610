package com.sheroshayari.auth.security;

import com.sheroshayari.auth.config.AuthProperties;
import com.sheroshayari.auth.entity.UserAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * PurposeTokenService - single-purpose, time-bounded tokens for email confirmation
 * and password reset.
 *
 * Tokens are never stored. Each one is the base64url encoding of
 * <pre>
 *   keyVersion (1 byte) | issuedAt epoch seconds (8 bytes) | HMAC-SHA256 (32 bytes)
 * </pre>
 * where the MAC covers the key version, issuedAt, the user id, the purpose
 * name and the user's current security stamp. Verification recomputes the MAC,
 * so a token stops verifying as soon as any of these change:
 * - a password reset rotates the security stamp (all outstanding tokens die)
 * - a token minted for one purpose or user is presented for another
 * - the server key version is bumped
 *
 * Tokens are valid for {@code auth.purpose-token.lifespan} (default 24 hours).
 * Base64url without padding keeps them safe inside query strings.
 */
@Service
@Slf4j
public class PurposeTokenService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int MAC_LENGTH = 32;
    private static final int TOKEN_LENGTH = 1 + Long.BYTES + MAC_LENGTH;

    private final SecretKeySpec key;
    private final byte keyVersion;
    private final Duration lifespan;
    private final Clock clock;

    @Autowired
    public PurposeTokenService(AuthProperties properties, Clock clock) {
        this(properties.purposeToken().secret(),
                properties.purposeToken().keyVersion(),
                properties.purposeToken().lifespan(),
                clock);
    }

    public PurposeTokenService(String secret, int keyVersion, Duration lifespan, Clock clock) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException(
                    "auth.purpose-token.secret must be at least 32 characters. Set PURPOSE_TOKEN_SECRET.");
        }
        if (keyVersion < 1 || keyVersion > 255) {
            throw new IllegalStateException("auth.purpose-token.key-version must be between 1 and 255");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.keyVersion = (byte) keyVersion;
        this.lifespan = lifespan;
        this.clock = clock;
    }

    /**
     * Mint a token bound to the user, the purpose and the user's current security stamp.
     */
    public String generate(UserAccount user, TokenPurpose purpose) {
        long issuedAt = clock.instant().getEpochSecond();
        byte[] mac = computeMac(keyVersion, issuedAt, user, purpose);

        ByteBuffer buffer = ByteBuffer.allocate(TOKEN_LENGTH);
        buffer.put(keyVersion);
        buffer.putLong(issuedAt);
        buffer.put(mac);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
    }

    /**
     * @return true iff the token was generated by {@link #generate} for this user and
     *         purpose, under the current key version and security stamp, and is not expired.
     *         Never throws.
     */
    public boolean verify(UserAccount user, TokenPurpose purpose, String token) {
        if (user == null || purpose == null || token == null || token.isBlank()) {
            return false;
        }

        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(token.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Purpose token is not valid base64url");
            return false;
        }
        if (raw.length != TOKEN_LENGTH) {
            return false;
        }

        ByteBuffer buffer = ByteBuffer.wrap(raw);
        byte version = buffer.get();
        long issuedAt = buffer.getLong();
        byte[] providedMac = new byte[MAC_LENGTH];
        buffer.get(providedMac);

        if (version != keyVersion) {
            return false;
        }

        Instant now = clock.instant();
        Instant issued = Instant.ofEpochSecond(issuedAt);
        if (issued.isAfter(now) || now.isAfter(issued.plus(lifespan))) {
            return false;
        }

        byte[] expectedMac = computeMac(version, issuedAt, user, purpose);
        return MessageDigest.isEqual(expectedMac, providedMac);
    }

    private byte[] computeMac(byte version, long issuedAt, UserAccount user, TokenPurpose purpose) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            mac.update(version);
            mac.update(ByteBuffer.allocate(Long.BYTES).putLong(issuedAt).array());
            updateField(mac, user.getId());
            updateField(mac, purpose.purposeName());
            updateField(mac, user.getSecurityStamp());
            return mac.doFinal();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC calculation failed", e);
        }
    }

    // Length-prefixed so that field boundaries cannot be shifted between values.
    private static void updateField(Mac mac, String value) {
        byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
        mac.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        mac.update(bytes);
    }
}
