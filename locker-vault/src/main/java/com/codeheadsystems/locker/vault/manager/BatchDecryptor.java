package com.codeheadsystems.locker.vault.manager;

import com.codeheadsystems.locker.crypto.codec.BlobFormat;
import com.codeheadsystems.locker.crypto.codec.SecretCodec;
import com.codeheadsystems.locker.crypto.config.VaultConfig;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import com.codeheadsystems.locker.crypto.model.SecretRecord;
import com.codeheadsystems.locker.crypto.model.VaultKey;
import com.codeheadsystems.locker.vault.model.BatchDecryptResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decrypts many current-format records for display, a group of {@link VaultConfig#batchSize()}
 * at a time on the supplied executor.
 * <p>
 * Each decode only reads the vault key, so decodes in a group share no mutable state. A record
 * that fails (or is a tagged legacy blob) is reported in {@link BatchDecryptResult#failedIds()}
 * and does not affect the others. Untagged blobs are always attempted as current blobs, since
 * a long current secret has the same length as a legacy blob.
 */
@Singleton
public class BatchDecryptor {

  private static final Logger log = LoggerFactory.getLogger(BatchDecryptor.class);

  private final SecretCodec codec;
  private final int batchSize;
  private final Executor executor;

  @Inject
  public BatchDecryptor(final VaultConfig config) {
    this(config, ForkJoinPool.commonPool());
  }

  public BatchDecryptor(final VaultConfig config, final Executor executor) {
    log.info("BatchDecryptor(batchSize={})", config.batchSize());
    this.codec = new SecretCodec(config);
    this.batchSize = config.batchSize();
    this.executor = executor;
  }

  /**
   * Decrypts every record.
   *
   * @param vaultKey the unlocked vault key
   * @param records  the records
   * @return plaintexts by id, plus the ids that failed
   * @throws IllegalStateException if the vault key is destroyed before a decode starts
   */
  public BatchDecryptResult decryptAll(final VaultKey vaultKey, final List<SecretRecord> records) {
    log.debug("decryptAll(records={})", records.size());
    Map<String, String> decrypted = new LinkedHashMap<>();
    Set<String> failed = new LinkedHashSet<>();
    for (int start = 0; start < records.size(); start += batchSize) {
      List<SecretRecord> group = records.subList(start, Math.min(start + batchSize, records.size()));
      List<CompletableFuture<String>> futures = new ArrayList<>(group.size());
      for (SecretRecord record : group) {
        futures.add(CompletableFuture.supplyAsync(() -> decryptOne(vaultKey, record), executor));
      }
      for (int i = 0; i < group.size(); i++) {
        String plaintext = join(futures.get(i));
        String id = group.get(i).id();
        if (plaintext == null) {
          failed.add(id);
        } else {
          decrypted.put(id, plaintext);
        }
      }
    }
    if (!failed.isEmpty()) {
      log.warn("{} of {} records could not be decrypted", failed.size(), records.size());
    }
    return new BatchDecryptResult(decrypted, failed);
  }

  private String decryptOne(VaultKey vaultKey, SecretRecord record) {
    String blob = record.encryptedPassword();
    if (codec.detectFormat(blob) != BlobFormat.CURRENT && !codec.isUntagged(blob)) {
      log.debug("Record {} is not in the current format", record.id());
      return null;
    }
    try {
      return codec.decodeCurrent(blob, vaultKey);
    } catch (VaultException e) {
      log.debug("Record {} failed to decrypt ({})", record.id(), e.kind());
      return null;
    }
  }

  private static String join(CompletableFuture<String> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }
}
