package com.codeheadsystems.locker.crypto.codec;

/**
 * Which scheme a stored ciphertext blob was written with.
 */
public enum BlobFormat {

  /**
   * {@code iv ‖ ciphertext} under the account's vault key, tagged {@code 0x02} when written by
   * this codec.
   */
  CURRENT,

  /**
   * {@code salt ‖ iv ‖ ciphertext} under a key derived from the master password, tagged
   * {@code 0x01} when written by this codec.
   */
  LEGACY,

  /**
   * Not base64, or a length no known layout produces.
   */
  UNRECOGNIZED
}
