package com.flint.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "user_identities")
@Getter
@Setter
public class UserIdentity {
  @Id
  @Column(name = "internal_user_id")
  private UUID internalUserId;

  @Column(name = "provider_user_id", nullable = false)
  private String providerUserId;

  @Column(name = "provider_secret", nullable = false, columnDefinition = "TEXT")
  private String encryptedProviderSecret;

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant rotatedAt;
}
