package com.flint.service.lock;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@ConditionalOnProperty(prefix = "flint.locking", name = "mode", havingValue = "advisory", matchIfMissing = true)
public class AdvisoryExclusiveLock implements ExclusiveLock {
  private static final Logger log = LoggerFactory.getLogger(AdvisoryExclusiveLock.class);
  private static final ResultSetExtractor<Void> IGNORE_RESULT = rs -> null;

  private final TransactionTemplate transactionTemplate;
  private final JdbcTemplate jdbcTemplate;

  public AdvisoryExclusiveLock(TransactionTemplate transactionTemplate, JdbcTemplate jdbcTemplate) {
    this.transactionTemplate = transactionTemplate;
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public <T> T withExclusiveLock(String key, Supplier<T> action) {
    long lockId = lockId(key);
    return transactionTemplate.execute(status -> {
      jdbcTemplate.query("select pg_advisory_xact_lock(?)", IGNORE_RESULT, lockId);
      log.debug("Acquired advisory lock {}", lockId);
      return action.get();
    });
  }

  static long lockId(String key) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
      return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
