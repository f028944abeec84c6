package com.codeheadsystems.locker.vault.store;

import com.codeheadsystems.locker.crypto.model.WrappedVaultKey;
import com.codeheadsystems.locker.model.VaultKeyDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AccountKeyStore} that keeps one {@link VaultKeyDocument} per account under
 * {@code users/{accountId}}.
 */
@Singleton
public class DocumentAccountKeyStore implements AccountKeyStore {

  private static final Logger log = LoggerFactory.getLogger(DocumentAccountKeyStore.class);

  private final DocumentStore documentStore;
  private final ObjectMapper mapper;

  @Inject
  public DocumentAccountKeyStore(final DocumentStore documentStore, final ObjectMapper mapper) {
    this.documentStore = documentStore;
    this.mapper = mapper;
  }

  static String key(String accountId) {
    if (accountId == null || accountId.isBlank() || accountId.contains("/")) {
      throw new IllegalArgumentException("Invalid account id: " + accountId);
    }
    return "users/" + accountId;
  }

  @Override
  public void store(String accountId, WrappedVaultKey wrapped) {
    documentStore.put(key(accountId), toJson(accountId, wrapped));
    log.debug("store(accountId={})", accountId);
  }

  @Override
  public boolean storeIfAbsent(String accountId, WrappedVaultKey wrapped) {
    boolean stored = documentStore.putIfAbsent(key(accountId), toJson(accountId, wrapped));
    log.debug("storeIfAbsent(accountId={}): {}", accountId, stored);
    return stored;
  }

  private String toJson(String accountId, WrappedVaultKey wrapped) {
    try {
      return mapper.writeValueAsString(VaultKeyDocument.fromWrappedVaultKey(wrapped));
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unable to serialize vault key document for " + accountId, e);
    }
  }

  @Override
  public Optional<WrappedVaultKey> load(String accountId) {
    Optional<String> json = documentStore.get(key(accountId));
    if (json.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(json.get(), VaultKeyDocument.class).wrappedVaultKey());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DocumentStoreException("Unreadable vault key document for " + accountId, e);
    }
  }
}
