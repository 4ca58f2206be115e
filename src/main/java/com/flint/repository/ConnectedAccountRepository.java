package com.flint.repository;

import com.flint.model.AccountProvider;
import com.flint.model.ConnectedAccount;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConnectedAccountRepository extends JpaRepository<ConnectedAccount, UUID> {
  List<ConnectedAccount> findByUserIdAndProviderOrderByCreatedAtAsc(UUID userId, AccountProvider provider);
  Optional<ConnectedAccount> findByIdAndUserId(UUID id, UUID userId);
  Optional<ConnectedAccount> findByUserIdAndProviderAndExternalAccountId(UUID userId,
                                                                         AccountProvider provider,
                                                                         String externalAccountId);
  long countByUserIdAndProvider(UUID userId, AccountProvider provider);
}
