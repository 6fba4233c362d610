package com.sheroshayari.auth.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BCryptPasswordHasher")
class BCryptPasswordHasherTest {

    private final BCryptPasswordHasher hasher = new BCryptPasswordHasher(4);

    @Test
    @DisplayName("verifies the password a hash was made from")
    void verifiesOriginalPassword() {
        String hash = hasher.hash("Pass123");

        assertThat(hasher.verify("Pass123", hash)).isTrue();
    }

    @Test
    @DisplayName("rejects any other password")
    void rejectsOtherPasswords() {
        String hash = hasher.hash("Pass123");

        assertThat(hasher.verify("pass123", hash)).isFalse();
        assertThat(hasher.verify("Pass1234", hash)).isFalse();
        assertThat(hasher.verify("", hash)).isFalse();
    }

    @Test
    @DisplayName("salts every hash, so equal passwords hash differently")
    void saltsEachHash() {
        String first = hasher.hash("Pass123");
        String second = hasher.hash("Pass123");

        assertThat(first).isNotEqualTo(second);
        assertThat(hasher.verify("Pass123", first)).isTrue();
        assertThat(hasher.verify("Pass123", second)).isTrue();
    }

    @Test
    @DisplayName("hash embeds the configured work factor and never the plaintext")
    void hashCarriesCostNotPlaintext() {
        String hash = hasher.hash("Pass123");

        assertThat(hash).startsWith("$2a$04$");
        assertThat(hash).doesNotContain("Pass123");
    }

    @Test
    @DisplayName("returns false instead of throwing for malformed hashes or null input")
    void malformedInputIsFalse() {
        assertThat(hasher.verify("Pass123", "not-a-bcrypt-hash")).isFalse();
        assertThat(hasher.verify("Pass123", "$2a$04$tooShort")).isFalse();
        assertThat(hasher.verify("Pass123", "")).isFalse();
        assertThat(hasher.verify("Pass123", null)).isFalse();
        assertThat(hasher.verify(null, hasher.hash("Pass123"))).isFalse();
    }

    @Test
    @DisplayName("refuses to hash a null password")
    void nullPasswordCannotBeHashed() {
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("refuses passwords beyond the 72 bytes BCrypt reads, so no two passwords share a hash")
    void passwordsBeyondBcryptLimit() {
        String prefix = "a".repeat(72);
        String prefixHash = hasher.hash(prefix);

        assertThatThrownBy(() -> hasher.hash(prefix + "X")).isInstanceOf(IllegalArgumentException.class);
        assertThat(hasher.verify(prefix + "Y", prefixHash)).isFalse();
        assertThat(hasher.verify(prefix, prefixHash)).isTrue();
        assertThat(hasher.maxPasswordBytes()).isEqualTo(72);
    }

    @Test
    @DisplayName("counts the limit in UTF-8 bytes, not characters")
    void limitIsInBytes() {
        String multiByte = "\u00e9".repeat(37);

        assertThatThrownBy(() -> hasher.hash(multiByte)).isInstanceOf(IllegalArgumentException.class);
        assertThat(hasher.verify("\u00e9".repeat(36), hasher.hash("\u00e9".repeat(36)))).isTrue();
    }
}
