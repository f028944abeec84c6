package com.codeheadsystems.locker.vault.manager;

/**
 * Session state of a {@link VaultKeyManager}.
 */
public enum VaultState {
  LOCKED,
  UNLOCKED
}
