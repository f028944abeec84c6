package com.codeheadsystems.locker.crypto.cipher;

/**
 * Symmetric encryption of raw byte buffers given a key and an IV.
 * <p>
 * The IV must be fresh for every encryption under a given key. Implementations do not choose
 * IVs themselves; callers generate one per call.
 */
public interface SymmetricCipher {

  /**
   * Required key length in bytes.
   *
   * @return the key length
   */
  int keyLength();

  /**
   * Required IV length in bytes.
   *
   * @return the iv length
   */
  int ivLength();

  /**
   * Block size in bytes; ciphertext lengths are multiples of it.
   *
   * @return the block size
   */
  int blockSize();

  /**
   * Encrypts the plaintext.
   *
   * @param plaintext the plaintext
   * @param key       the key
   * @param iv        the iv
   * @return the ciphertext
   */
  byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv);

  /**
   * Decrypts the ciphertext.
   *
   * @param ciphertext the ciphertext
   * @param key        the key
   * @param iv         the iv
   * @return the plaintext
   * @throws com.codeheadsystems.locker.crypto.exceptions.VaultException with
   *                     {@code DECRYPTION_FAILED} on bad length, bad padding or (usually) wrong key
   */
  byte[] decrypt(byte[] ciphertext, byte[] key, byte[] iv);
}
