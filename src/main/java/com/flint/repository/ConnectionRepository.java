package com.flint.repository;

import com.flint.model.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ConnectionRepository extends JpaRepository<Connection, UUID> {
  List<Connection> findByUserIdOrderByCreatedAtAsc(UUID userId);
  Optional<Connection> findByUserIdAndProviderAuthorizationId(UUID userId, String providerAuthorizationId);
  long countByUserId(UUID userId);

  @Query("select c from Connection c where c.lastSyncAt is null or c.lastSyncAt < :cutoff")
  List<Connection> findNotSyncedSince(@Param("cutoff") Instant cutoff);

  @Modifying
  @Transactional
  @Query("delete from Connection c where c.userId = :userId")
  int deleteByUserId(@Param("userId") UUID userId);
}
