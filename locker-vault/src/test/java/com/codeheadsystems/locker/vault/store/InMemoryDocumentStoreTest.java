package com.codeheadsystems.locker.vault.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemoryDocumentStoreTest {

  @Test
  void putGetDelete() {
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    assertThat(store.get("users/alice")).isEmpty();

    store.put("users/alice", "{}");
    store.put("users/alice", "{\"a\":1}");
    assertThat(store.get("users/alice")).contains("{\"a\":1}");
    assertThat(store.size()).isEqualTo(1);

    store.delete("users/alice");
    store.delete("users/missing");
    assertThat(store.get("users/alice")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void putIfAbsent_keepsExistingDocument() {
    InMemoryDocumentStore store = new InMemoryDocumentStore();

    assertThat(store.putIfAbsent("users/alice", "{\"a\":1}")).isTrue();
    assertThat(store.putIfAbsent("users/alice", "{\"a\":2}")).isFalse();

    assertThat(store.get("users/alice")).contains("{\"a\":1}");
  }
}
