package com.branchsync.ingest.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates long-lived branch sync tokens sent as {@code Authorization: Bearer <token>}.
 * Requests without a matching token continue unauthenticated and are rejected by the
 * authorization rules.
 */
public class SyncTokenAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(SyncTokenAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    static final String SYNC_ROLE = "SYNC";

    private final List<byte[]> tokens;

    public SyncTokenAuthenticationFilter(List<String> tokens) {
        this.tokens = tokens.stream()
                .filter(StringUtils::hasText)
                .map(token -> token.trim().getBytes(StandardCharsets.UTF_8))
                .toList();
        if (this.tokens.isEmpty()) {
            log.warn("No sync API tokens configured; every /api/attendance request will be rejected");
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            byte[] presented = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
            if (matches(presented)) {
                UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                        "branch-sync", null, List.of(new SimpleGrantedAuthority("ROLE_" + SYNC_ROLE)));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.warn("Rejected sync token from {}", request.getRemoteAddr());
            }
        }
        chain.doFilter(request, response);
    }

    private boolean matches(byte[] presented) {
        boolean matched = false;
        for (byte[] token : tokens) {
            matched |= MessageDigest.isEqual(token, presented);
        }
        return matched;
    }
}
