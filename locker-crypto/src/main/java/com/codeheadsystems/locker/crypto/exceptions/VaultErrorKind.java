package com.codeheadsystems.locker.crypto.exceptions;

/**
 * Closed set of failure kinds raised by the vault crypto layer.
 */
public enum VaultErrorKind {

  /**
   * Bad key, corrupted ciphertext or bad padding. These cannot be told apart.
   */
  DECRYPTION_FAILED,

  /**
   * The blob is not base64, or too short to hold the header its format requires.
   */
  INVALID_FORMAT,

  /**
   * The vault key could not be unwrapped. Callers present this as an incorrect master password.
   */
  UNLOCK_FAILED,

  /**
   * Key derivation was given malformed input (empty secret or salt, bad output length).
   */
  KEY_DERIVATION
}
