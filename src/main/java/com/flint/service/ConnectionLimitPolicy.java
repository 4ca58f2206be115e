package com.flint.service;

import com.flint.model.AccountProvider;
import com.flint.model.SubscriptionTier;
import com.flint.model.User;
import com.flint.repository.ConnectedAccountRepository;
import com.flint.repository.ConnectionRepository;
import com.flint.repository.UserRepository;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class ConnectionLimitPolicy {
  private final UserRepository userRepository;
  private final ConnectedAccountRepository accountRepository;
  private final ConnectionRepository connectionRepository;

  public ConnectionLimitPolicy(UserRepository userRepository,
                               ConnectedAccountRepository accountRepository,
                               ConnectionRepository connectionRepository) {
    this.userRepository = userRepository;
    this.accountRepository = accountRepository;
    this.connectionRepository = connectionRepository;
  }

  // null when unlimited
  public static Integer accountLimit(SubscriptionTier tier, boolean admin) {
    if (admin) {
      return null;
    }
    if (tier == null) {
      return 2;
    }
    return switch (tier) {
      case FREE -> 2;
      case BASIC -> 3;
      case PRO -> 5;
      case PREMIUM -> null;
    };
  }

  public long currentConnections(UUID userId) {
    return accountRepository.countByUserIdAndProvider(userId, AccountProvider.BANK)
        + connectionRepository.countByUserId(userId);
  }

  public Allowance allowance(UUID userId) {
    User user = userRepository.findById(userId).orElse(null);
    SubscriptionTier tier = user == null ? SubscriptionTier.FREE : user.getSubscriptionTier();
    boolean admin = user != null && user.isAdmin();
    return new Allowance(tier, admin, accountLimit(tier, admin), currentConnections(userId));
  }

  public record Allowance(SubscriptionTier tier, boolean admin, Integer limit, long current) {
    public boolean unlimited() {
      return limit == null;
    }

    public long remaining() {
      if (limit == null) {
        return Long.MAX_VALUE;
      }
      return Math.max(0, limit - current);
    }

    public int accept(int offered) {
      return (int) Math.min(offered, remaining());
    }
  }
}
