package com.tokentracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import com.tokentracker.backend.modules.auth.domain.AccountRole;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    public static final String TOKEN_TYPE = "Bearer";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public AccessToken issueAccessToken(UserAccount account) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        String token = Jwts.builder()
                .subject(account.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim("username", account.getUsername())
                .claim("role", account.getRole().name())
                .signWith(key, SIG.HS256)
                .compact();

        return new AccessToken(token, TOKEN_TYPE, accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone()));
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String roleClaim = claims.get("role", String.class);
            if (subject == null || roleClaim == null) {
                throw new InvalidTokenException("Access token is missing required claims", null);
            }
            Long accountId = Long.valueOf(subject);
            String username = claims.get("username", String.class);
            return new ParsedToken(accountId, username, AccountRole.valueOf(roleClaim));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record AccessToken(String token, String tokenType, long expiresIn, OffsetDateTime issuedAt) {
    }

    public record ParsedToken(Long accountId, String username, AccountRole role) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
