package com.sheroshayari.auth.service;

import com.sheroshayari.auth.security.IssuedToken;
import lombok.Value;

/**
 * Successful login: the account's identity and the bearer token minted for it.
 */
@Value
public class LoginResult {
    String userId;
    String email;
    IssuedToken token;
}
