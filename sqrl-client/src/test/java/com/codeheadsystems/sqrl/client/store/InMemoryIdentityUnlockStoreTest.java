package com.codeheadsystems.sqrl.client.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryIdentityUnlockStoreTest {

  private InMemoryIdentityUnlockStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryIdentityUnlockStore();
  }

  @Test
  void load_unknownIdentity_isEmpty() {
    assertThat(store.load("nobody")).isEmpty();
  }

  @Test
  void store_thenLoad_returnsSameBytes() {
    store.store("id", new byte[]{1, 2, 3});

    assertThat(store.load("id")).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
  }

  @Test
  void store_replacesExistingBlock() {
    store.store("id", new byte[]{1});
    store.store("id", new byte[]{2});

    assertThat(store.load("id")).hasValueSatisfying(b -> assertThat(b).containsExactly(2));
  }

  @Test
  void storedBytes_areIsolatedFromCallerArrays() {
    byte[] block = {1, 2, 3};
    store.store("id", block);
    block[0] = 9;
    store.load("id").orElseThrow()[1] = 9;

    assertThat(store.load("id")).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
  }

  @Test
  void delete_removesBlock() {
    store.store("id", new byte[]{1});

    store.delete("id");

    assertThat(store.load("id")).isEmpty();
  }

  @Test
  void delete_unknownIdentity_isNoOp() {
    store.delete("nobody");

    assertThat(store.load("nobody")).isEmpty();
  }
}
