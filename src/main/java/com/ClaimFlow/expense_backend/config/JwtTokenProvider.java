package com.ClaimFlow.expense_backend.config;

import com.ClaimFlow.expense_backend.model.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.Map;
import java.util.function.Function;

@Component
@Slf4j
public class JwtTokenProvider {

    static final String TOKEN_TYPE_CLAIM = "type";
    static final String ACCESS_TOKEN = "access";
    static final String REFRESH_TOKEN = "refresh";

    private final JwtProperties jwtProperties;
    private final Key key;

    public JwtTokenProvider(JwtProperties jwtProperties) {
        this.jwtProperties = jwtProperties;
        this.key = Keys.hmacShaKeyFor(jwtProperties.getSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(User user) {
        return buildToken(user, ACCESS_TOKEN, jwtProperties.getExpiration());
    }

    public String generateRefreshToken(User user) {
        return buildToken(user, REFRESH_TOKEN, jwtProperties.getRefreshExpiration());
    }

    private String buildToken(User user, String type, long validityMillis) {
        Date now = new Date();
        return Jwts.builder()
                .setClaims(Map.of(
                        TOKEN_TYPE_CLAIM, type,
                        "userId", user.getId().toString(),
                        "role", user.getRole().name()
                ))
                .setSubject(user.getUsername())
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + validityMillis))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public String extractUsername(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public boolean isRefreshToken(String token) {
        return REFRESH_TOKEN.equals(extractClaim(token, claims -> claims.get(TOKEN_TYPE_CLAIM, String.class)));
    }

    public boolean isAccessToken(String token) {
        return ACCESS_TOKEN.equals(extractClaim(token, claims -> claims.get(TOKEN_TYPE_CLAIM, String.class)));
    }

    /**
     * Signature and expiry are checked by the parser; this adds the subject match.
     */
    public boolean isTokenValid(String token, UserDetails userDetails) {
        String username = extractUsername(token);
        return username.equals(userDetails.getUsername()) && userDetails.isEnabled();
    }

    public <T> T extractClaim(String token, Function<Claims, T> resolver) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();
        return resolver.apply(claims);
    }
}
