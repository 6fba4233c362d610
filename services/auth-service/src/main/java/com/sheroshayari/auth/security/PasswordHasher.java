package com.sheroshayari.auth.security;

/**
 * One-way salted password hashing.
 */
public interface PasswordHasher {

    /**
     * Hash a plaintext password with a fresh random salt.
     */
    String hash(String plaintext);

    /**
     * @return true iff {@code plaintext} matches {@code hash}; false for null input
     *         or a hash that is not in the expected format
     */
    boolean verify(String plaintext, String hash);

    /**
     * Longest password, in UTF-8 bytes, that the algorithm hashes in full.
     */
    default int maxPasswordBytes() {
        return Integer.MAX_VALUE;
    }
}
