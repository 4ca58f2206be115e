package com.flint.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "brokerage_connections",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_brokerage_connections_user_authorization",
        columnNames = {"user_id", "provider_authorization_id"}))
@Getter
@Setter
public class Connection {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "provider_authorization_id", nullable = false)
  private String providerAuthorizationId;

  @Column(nullable = false)
  private String institutionName;

  @Column(nullable = false)
  private boolean disabled;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @Column
  private Instant lastSyncAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
  }
}
