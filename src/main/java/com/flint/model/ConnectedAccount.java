package com.flint.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "connected_accounts",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_connected_accounts_external",
        columnNames = {"user_id", "provider", "external_account_id"}))
@Getter
@Setter
public class ConnectedAccount {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private AccountProvider provider;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private AccountType accountType;

  @Column(name = "external_account_id", nullable = false)
  private String externalAccountId;

  @Column(nullable = false)
  private String displayName;

  @Column
  private String institutionName;

  @Column
  private String institutionId;

  @Column
  private String lastFour;

  // signed, credit accounts hold a negative value
  @Column(precision = 19, scale = 4)
  private BigDecimal balance;

  @Column(nullable = false)
  private String currency = "USD";

  @Column(columnDefinition = "TEXT")
  private String encryptedAccessToken;

  @Column
  private String enrollmentId;

  @Column
  private Instant lastSyncedAt;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
