package com.codeheadsystems.locker.crypto.model;

import java.security.MessageDigest;
import java.util.Arrays;
import javax.security.auth.Destroyable;

/**
 * The unwrapped 32-byte key that encrypts stored secrets.
 * <p>
 * {@link #bytes()} hands out a copy, so an operation that has already started keeps working
 * after the session key is {@link #destroy() destroyed}; only later calls fail.
 */
public final class VaultKey implements Destroyable {

  /**
   * Vault key length in bytes.
   */
  public static final int LENGTH = 32;

  private final byte[] key;
  private volatile boolean destroyed;

  private VaultKey(byte[] key) {
    this.key = key;
  }

  /**
   * Wraps a copy of the given key bytes.
   *
   * @param key exactly {@link #LENGTH} bytes
   * @return the vault key
   */
  public static VaultKey of(byte[] key) {
    if (key == null || key.length != LENGTH) {
      throw new IllegalArgumentException("Vault key must be " + LENGTH + " bytes");
    }
    return new VaultKey(key.clone());
  }

  /**
   * Returns a copy of the key bytes. The caller owns the copy.
   *
   * @return the key bytes
   * @throws IllegalStateException if the key has been destroyed
   */
  public byte[] bytes() {
    if (destroyed) {
      throw new IllegalStateException("Vault key has been destroyed");
    }
    byte[] copy = key.clone();
    if (destroyed) {
      Arrays.fill(copy, (byte) 0);
      throw new IllegalStateException("Vault key has been destroyed");
    }
    return copy;
  }

  @Override
  public void destroy() {
    destroyed = true;
    Arrays.fill(key, (byte) 0);
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  /**
   * Constant-time comparison against raw key bytes.
   *
   * @param other the other key bytes
   * @return true if equal and this key is not destroyed
   */
  public boolean matches(byte[] other) {
    return !destroyed && MessageDigest.isEqual(key, other);
  }

  @Override
  public String toString() {
    return "VaultKey[" + (destroyed ? "destroyed" : "redacted") + "]";
  }
}
