package com.codeheadsystems.pbkdf2.manager;

import com.codeheadsystems.pbkdf2.config.Pbkdf2Config;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs hashing and verification on a dedicated executor so the CPU-bound derivation does not
 * occupy request or I/O threads. The executor should be sized for CPU work.
 */
@Singleton
public class AsyncPbkdf2Manager {

  private static final Logger log = LoggerFactory.getLogger(AsyncPbkdf2Manager.class);

  private final Pbkdf2HashManager hashManager;
  private final Pbkdf2VerifyManager verifyManager;
  private final Executor executor;

  /**
   * Instantiates a new async manager.
   *
   * @param hashManager   the hash manager
   * @param verifyManager the verify manager
   * @param executor      executor running the derivations
   */
  @Inject
  public AsyncPbkdf2Manager(final Pbkdf2HashManager hashManager,
                            final Pbkdf2VerifyManager verifyManager,
                            final Executor executor) {
    log.info("AsyncPbkdf2Manager({}, {}, {})", hashManager, verifyManager, executor);
    this.hashManager = hashManager;
    this.verifyManager = verifyManager;
    this.executor = executor;
  }

  /**
   * Hashes on the executor. Argument and backend failures complete the future exceptionally.
   *
   * @param secret the secret
   * @return the future record
   */
  public CompletableFuture<String> hashAsync(final String secret) {
    return CompletableFuture.supplyAsync(() -> hashManager.hash(secret), executor);
  }

  /**
   * Hashes on the executor with the given configuration.
   *
   * @param secret the secret
   * @param config the config
   * @return the future record
   */
  public CompletableFuture<String> hashAsync(final String secret, final Pbkdf2Config config) {
    return CompletableFuture.supplyAsync(() -> hashManager.hash(secret, config), executor);
  }

  /**
   * Verifies on the executor. The future always completes normally.
   *
   * @param secret the secret
   * @param record the record
   * @return the future result
   */
  public CompletableFuture<Boolean> verifyAsync(final String secret, final String record) {
    return CompletableFuture.supplyAsync(() -> verifyManager.verify(secret, record), executor);
  }
}
