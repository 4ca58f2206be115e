package com.flint.repository;

import com.flint.model.Holding;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface HoldingRepository extends JpaRepository<Holding, UUID> {
  List<Holding> findByUserIdAndAccountIdOrderBySymbolAsc(UUID userId, String accountId);

  @Modifying
  @Transactional
  @Query("delete from Holding h where h.userId = :userId and h.accountId = :accountId")
  int deleteByUserIdAndAccountId(@Param("userId") UUID userId, @Param("accountId") String accountId);

  @Modifying
  @Transactional
  @Query("delete from Holding h where h.userId = :userId and h.providerAuthorizationId = :authorizationId")
  int deleteByUserIdAndAuthorizationId(@Param("userId") UUID userId,
                                       @Param("authorizationId") String authorizationId);

  @Modifying
  @Transactional
  @Query("delete from Holding h where h.userId = :userId")
  int deleteByUserId(@Param("userId") UUID userId);
}
