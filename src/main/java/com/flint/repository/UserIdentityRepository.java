package com.flint.repository;

import com.flint.model.UserIdentity;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserIdentityRepository extends JpaRepository<UserIdentity, UUID> {
  List<UserIdentity> findByCreatedAtBefore(Instant cutoff);
}
