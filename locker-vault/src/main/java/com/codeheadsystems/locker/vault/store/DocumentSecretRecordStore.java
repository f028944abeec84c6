package com.codeheadsystems.locker.vault.store;

import com.codeheadsystems.locker.crypto.model.SecretRecord;
import com.codeheadsystems.locker.model.SecretDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecretRecordStore} that keeps each record as a {@link SecretDocument} under
 * {@code users/{accountId}/passwords/{id}}, plus an id index under
 * {@code users/{accountId}/passwords} so the account's records can be listed without any
 * query support from the document store.
 */
@Singleton
public class DocumentSecretRecordStore implements SecretRecordStore {

  private static final Logger log = LoggerFactory.getLogger(DocumentSecretRecordStore.class);
  private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
  };

  private final DocumentStore documentStore;
  private final ObjectMapper mapper;

  @Inject
  public DocumentSecretRecordStore(final DocumentStore documentStore, final ObjectMapper mapper) {
    this.documentStore = documentStore;
    this.mapper = mapper;
  }

  private static String indexKey(String accountId) {
    return DocumentAccountKeyStore.key(accountId) + "/passwords";
  }

  private static String recordKey(String accountId, String id) {
    if (id == null || id.isBlank() || id.contains("/")) {
      throw new IllegalArgumentException("Invalid record id: " + id);
    }
    return indexKey(accountId) + "/" + id;
  }

  @Override
  public List<SecretRecord> list(String accountId) {
    List<SecretRecord> records = new ArrayList<>();
    for (String id : readIndex(accountId)) {
      load(accountId, id).ifPresent(records::add);
    }
    return records;
  }

  @Override
  public Optional<SecretRecord> load(String accountId, String id) {
    Optional<String> json = documentStore.get(recordKey(accountId, id));
    if (json.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(json.get(), SecretDocument.class).secretRecord());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DocumentStoreException("Unreadable secret document " + id, e);
    }
  }

  @Override
  public synchronized void save(String accountId, SecretRecord record) {
    try {
      documentStore.put(recordKey(accountId, record.id()),
          mapper.writeValueAsString(SecretDocument.fromSecretRecord(record)));
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unable to serialize secret document " + record.id(), e);
    }
    LinkedHashSet<String> ids = readIndex(accountId);
    if (ids.add(record.id())) {
      writeIndex(accountId, ids);
    }
    log.debug("save(accountId={}, id={})", accountId, record.id());
  }

  @Override
  public synchronized void delete(String accountId, String id) {
    documentStore.delete(recordKey(accountId, id));
    LinkedHashSet<String> ids = readIndex(accountId);
    if (ids.remove(id)) {
      writeIndex(accountId, ids);
    }
  }

  private LinkedHashSet<String> readIndex(String accountId) {
    Optional<String> json = documentStore.get(indexKey(accountId));
    if (json.isEmpty()) {
      return new LinkedHashSet<>();
    }
    try {
      return new LinkedHashSet<>(mapper.readValue(json.get(), ID_LIST));
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unreadable secret index for " + accountId, e);
    }
  }

  private void writeIndex(String accountId, LinkedHashSet<String> ids) {
    try {
      documentStore.put(indexKey(accountId), mapper.writeValueAsString(new ArrayList<>(ids)));
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Unable to serialize secret index for " + accountId, e);
    }
  }
}
