package com.flint.service;

import com.flint.model.UserIdentity;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.UserIdentityRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class CredentialStore {
  private final UserIdentityRepository repository;
  private final CryptoService cryptoService;
  private final Clock clock;

  public CredentialStore(UserIdentityRepository repository, CryptoService cryptoService, Clock clock) {
    this.repository = repository;
    this.cryptoService = cryptoService;
    this.clock = clock;
  }

  public Optional<ProviderCredentials> find(UUID userId) {
    return repository.findById(userId).map(this::toCredentials);
  }

  public boolean exists(UUID userId) {
    return repository.existsById(userId);
  }

  public ProviderCredentials save(UUID userId, ProviderCredentials credentials) {
    UserIdentity identity = new UserIdentity();
    identity.setInternalUserId(userId);
    identity.setProviderUserId(credentials.providerUserId());
    identity.setEncryptedProviderSecret(cryptoService.encrypt(credentials.providerSecret()));
    identity.setCreatedAt(clock.instant());
    repository.saveAndFlush(identity);
    return credentials;
  }

  public void rotateSecret(UUID userId, String newSecret) {
    repository.findById(userId).ifPresent(identity -> {
      identity.setEncryptedProviderSecret(cryptoService.encrypt(newSecret));
      identity.setRotatedAt(clock.instant());
      repository.save(identity);
    });
  }

  public void delete(UUID userId) {
    if (repository.existsById(userId)) {
      repository.deleteById(userId);
    }
  }

  public List<UUID> userIdsCreatedBefore(Instant cutoff) {
    return repository.findByCreatedAtBefore(cutoff).stream()
        .sorted((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()))
        .map(UserIdentity::getInternalUserId)
        .toList();
  }

  private ProviderCredentials toCredentials(UserIdentity identity) {
    return new ProviderCredentials(identity.getProviderUserId(),
        cryptoService.decrypt(identity.getEncryptedProviderSecret()));
  }
}
