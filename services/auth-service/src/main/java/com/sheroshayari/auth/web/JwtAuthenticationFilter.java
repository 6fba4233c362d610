package com.sheroshayari.auth.web;

import com.sheroshayari.auth.security.TokenIssuer;
import com.sheroshayari.auth.security.TokenValidation;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates requests carrying "Authorization: Bearer &lt;token&gt;".
 *
 * A token that validates puts its {@link com.sheroshayari.auth.security.TokenClaims}
 * into the security context as the principal. A missing or rejected token
 * leaves the request anonymous; the security chain then answers 401 for
 * protected endpoints.
 */
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String BEARER_PREFIX = "Bearer ";

    private final TokenIssuer tokenIssuer;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            TokenValidation validation = tokenIssuer.validate(token);
            if (validation.isValid()) {
                var authentication = new UsernamePasswordAuthenticationToken(
                        validation.getClaims(), token, AuthorityUtils.createAuthorityList("ROLE_USER"));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.debug("Bearer token rejected: {}", validation.getError());
            }
        }
        chain.doFilter(request, response);
    }
}
