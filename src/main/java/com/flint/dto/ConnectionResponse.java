package com.flint.dto;

import com.flint.model.ConnectionHealth;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ConnectionResponse {
  private UUID id;
  private String authorizationId;
  private String institutionName;
  private boolean disabled;
  private ConnectionHealth health;
  private Instant createdAt;
  private Instant updatedAt;
  private Instant lastSyncAt;
}
