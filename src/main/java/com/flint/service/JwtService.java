package com.flint.service;

import com.flint.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

@Service
public class JwtService {
  private final JwtProperties properties;
  private final SecretKey key;

  public JwtService(JwtProperties properties) {
    this.properties = properties;
    this.key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
  }

  public String generateToken(UUID userId) {
    Instant now = Instant.now();
    Instant expiry = now.plusSeconds(properties.ttlMinutes() * 60L);

    return Jwts.builder()
        .setSubject(userId.toString())
        .setIssuer(properties.issuer())
        .setIssuedAt(Date.from(now))
        .setExpiration(Date.from(expiry))
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();
  }

  public UUID parseUserId(String token) {
    JwtParserBuilder parser = Jwts.parserBuilder().setSigningKey(key);
    if (properties.issuer() != null && !properties.issuer().isBlank()) {
      parser.requireIssuer(properties.issuer());
    }
    Claims claims = parser.build()
        .parseClaimsJws(token)
        .getBody();
    return UUID.fromString(claims.getSubject());
  }
}
