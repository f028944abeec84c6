package com.codeheadsystems.locker.crypto.verify;

import com.codeheadsystems.locker.crypto.common.ByteUtils;
import com.codeheadsystems.locker.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Produces and checks the stored artifact that gates unlock before the vault key is touched.
 * <p>
 * Two shapes are accepted:
 * <ul>
 *   <li>{@code hex(SHA-256(secret ‖ FIXED_SALT))} as written by {@link #hash(byte[])}</li>
 *   <li>{@code base64(salt16) + "." + hex(SHA-256(secret ‖ salt16))} as written by
 *       {@link #hashSalted(byte[])}</li>
 * </ul>
 * Neither is a password KDF. The vault key's own protection does not depend on this artifact.
 */
public class MasterSecretVerifier {

  static final byte[] FIXED_SALT = "super-locker-master-verifier-v1".getBytes(StandardCharsets.US_ASCII);
  private static final int SALTED_SALT_LENGTH = 16;
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final RandomProvider randomProvider;

  public MasterSecretVerifier(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Hashes the secret with the fixed application salt.
   *
   * @param secret the master password, UTF-8
   * @return the lower-case hex digest
   */
  public String hash(byte[] secret) {
    return Hex.toHexString(sha256(secret, FIXED_SALT));
  }

  /**
   * Hashes the secret with a fresh 16-byte salt.
   *
   * @param secret the master password, UTF-8
   * @return {@code base64(salt).hexDigest}
   */
  public String hashSalted(byte[] secret) {
    byte[] salt = randomProvider.randomBytes(SALTED_SALT_LENGTH);
    return B64.encodeToString(salt) + "." + Hex.toHexString(sha256(secret, salt));
  }

  /**
   * Checks a secret against either stored shape. Comparison is constant-time over the digest.
   *
   * @param secret     the candidate master password, UTF-8
   * @param storedHash the stored artifact
   * @return true if the secret matches; false for a mismatch or a malformed artifact
   */
  public boolean verify(byte[] secret, String storedHash) {
    if (secret == null || storedHash == null || storedHash.isBlank()) {
      return false;
    }
    byte[] salt;
    String hexDigest;
    int dot = storedHash.indexOf('.');
    if (dot < 0) {
      salt = FIXED_SALT;
      hexDigest = storedHash;
    } else {
      try {
        salt = B64D.decode(storedHash.substring(0, dot));
      } catch (IllegalArgumentException e) {
        return false;
      }
      hexDigest = storedHash.substring(dot + 1);
    }
    byte[] expected;
    try {
      expected = Hex.decode(hexDigest);
    } catch (DecoderException e) {
      return false;
    }
    byte[] actual = sha256(secret, salt);
    try {
      return MessageDigest.isEqual(expected, actual);
    } finally {
      ByteUtils.wipe(actual);
    }
  }

  private static byte[] sha256(byte[] secret, byte[] salt) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      digest.update(secret);
      digest.update(salt);
      return digest.digest();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
