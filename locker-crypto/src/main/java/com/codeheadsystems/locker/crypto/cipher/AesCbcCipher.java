package com.codeheadsystems.locker.crypto.cipher;

import com.codeheadsystems.locker.crypto.exceptions.VaultErrorKind;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import java.util.Arrays;
import org.bouncycastle.crypto.BufferedBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

/**
 * AES-256-CBC with PKCS7 padding.
 * <p>
 * Provides confidentiality only. There is no MAC: a flipped ciphertext bit usually garbles one
 * block of plaintext without any error, and a wrong key is caught only when the padding check
 * happens to fail.
 */
public class AesCbcCipher implements SymmetricCipher {

  private static final int KEY_LENGTH = 32;
  private static final int BLOCK_SIZE = 16;

  @Override
  public int keyLength() {
    return KEY_LENGTH;
  }

  @Override
  public int ivLength() {
    return BLOCK_SIZE;
  }

  @Override
  public int blockSize() {
    return BLOCK_SIZE;
  }

  @Override
  public byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv) {
    BufferedBlockCipher cipher = newCipher(true, key, iv);
    try {
      return process(cipher, plaintext);
    } catch (InvalidCipherTextException e) {
      // padding is only checked on decryption
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  @Override
  public byte[] decrypt(byte[] ciphertext, byte[] key, byte[] iv) {
    if (ciphertext == null || ciphertext.length == 0 || ciphertext.length % BLOCK_SIZE != 0) {
      throw new VaultException(VaultErrorKind.DECRYPTION_FAILED,
          "Ciphertext length is not a positive multiple of " + BLOCK_SIZE);
    }
    BufferedBlockCipher cipher = newCipher(false, key, iv);
    try {
      return process(cipher, ciphertext);
    } catch (InvalidCipherTextException | DataLengthException e) {
      throw new VaultException(VaultErrorKind.DECRYPTION_FAILED, "Decryption failed", e);
    }
  }

  private BufferedBlockCipher newCipher(boolean forEncryption, byte[] key, byte[] iv) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("AES-256 key must be " + KEY_LENGTH + " bytes");
    }
    if (iv == null || iv.length != BLOCK_SIZE) {
      throw new IllegalArgumentException("CBC IV must be " + BLOCK_SIZE + " bytes");
    }
    PaddedBufferedBlockCipher cipher = new PaddedBufferedBlockCipher(
        CBCBlockCipher.newInstance(AESEngine.newInstance()), new PKCS7Padding());
    cipher.init(forEncryption, new ParametersWithIV(new KeyParameter(key), iv));
    return cipher;
  }

  private static byte[] process(BufferedBlockCipher cipher, byte[] input)
      throws InvalidCipherTextException {
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    int len = cipher.processBytes(input, 0, input.length, out, 0);
    len += cipher.doFinal(out, len);
    return len == out.length ? out : Arrays.copyOf(out, len);
  }
}
