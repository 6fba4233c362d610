package com.sheroshayari.auth.security;

/**
 * Operations a purpose token can authorize. The purpose name is part of the
 * MAC input, so a token for one purpose never verifies for another.
 */
public enum TokenPurpose {
    EMAIL_CONFIRMATION("EmailConfirmation"),
    PASSWORD_RESET("ResetPassword");

    private final String purposeName;

    TokenPurpose(String purposeName) {
        this.purposeName = purposeName;
    }

    public String purposeName() {
        return purposeName;
    }
}
