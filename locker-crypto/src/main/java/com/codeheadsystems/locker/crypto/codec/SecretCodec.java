package com.codeheadsystems.locker.crypto.codec;

import static com.codeheadsystems.locker.crypto.common.ByteUtils.concat;

import com.codeheadsystems.locker.crypto.common.ByteUtils;
import com.codeheadsystems.locker.crypto.config.VaultConfig;
import com.codeheadsystems.locker.crypto.exceptions.VaultErrorKind;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import com.codeheadsystems.locker.crypto.model.VaultKey;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes and decodes a single stored secret to and from a self-describing base64 blob.
 * <p>
 * Layouts, after base64 decoding:
 * <ul>
 *   <li>current: {@code 0x02 ‖ iv(16) ‖ ciphertext}</li>
 *   <li>legacy: {@code 0x01 ‖ salt(32) ‖ iv(16) ‖ ciphertext}</li>
 *   <li>untagged current (older data): {@code iv(16) ‖ ciphertext}</li>
 *   <li>untagged legacy (older data): {@code salt(32) ‖ iv(16) ‖ ciphertext}</li>
 * </ul>
 * CBC ciphertext is a whole number of 16-byte blocks, so untagged blobs are always a multiple of
 * 16 bytes long and tagged ones are one byte over. That residue is what separates them; the tag
 * byte is only read from blobs with the tagged residue. Untagged blobs fall back to the length
 * heuristic: anything long enough for salt, IV and one block is treated as legacy.
 * <p>
 * Decoded plaintext must be well-formed UTF-8. CBC has no MAC, so a wrong key passes the padding
 * check about once in 256 tries; the strict charset check rejects that garbage.
 */
public class SecretCodec {

  static final byte LEGACY_TAG = 0x01;
  static final byte CURRENT_TAG = 0x02;

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final VaultConfig config;

  public SecretCodec(final VaultConfig config) {
    this.config = config;
  }

  /**
   * Classifies a blob by shape. Never throws.
   *
   * @param blob the base64 blob
   * @return the blob format
   */
  public BlobFormat detectFormat(String blob) {
    byte[] bytes = tryDecode(blob);
    if (bytes == null || bytes.length == 0) {
      return BlobFormat.UNRECOGNIZED;
    }
    int n = bytes.length;
    int block = config.blockSize();
    int iv = config.ivLength();
    int residue = n % block;
    if (residue == 1) {
      if (bytes[0] == CURRENT_TAG && n >= 1 + iv + block) {
        return BlobFormat.CURRENT;
      }
      if (bytes[0] == LEGACY_TAG && n >= 1 + VaultConfig.SALT_LENGTH + iv + block) {
        return BlobFormat.LEGACY;
      }
      return BlobFormat.UNRECOGNIZED;
    }
    if (residue == 0) {
      if (n >= VaultConfig.SALT_LENGTH + iv + block) {
        return BlobFormat.LEGACY;
      }
      if (n >= iv + block) {
        return BlobFormat.CURRENT;
      }
    }
    return BlobFormat.UNRECOGNIZED;
  }

  /**
   * Best-effort check for the legacy single-tier format.
   *
   * @param blob the base64 blob
   * @return true if the blob looks like a legacy blob
   */
  public boolean isLegacyFormat(String blob) {
    return detectFormat(blob) == BlobFormat.LEGACY;
  }

  /**
   * True if the blob carries no format tag, i.e. it predates tagging.
   *
   * @param blob the base64 blob
   * @return true if untagged
   */
  public boolean isUntagged(String blob) {
    byte[] bytes = tryDecode(blob);
    return bytes != null && bytes.length > 0 && bytes.length % config.blockSize() == 0;
  }

  /**
   * Encrypts under the vault key with a fresh IV and returns a tagged current-format blob.
   *
   * @param plaintext the plaintext
   * @param vaultKey  the unlocked vault key
   * @return the base64 blob
   */
  public String encodeCurrent(String plaintext, VaultKey vaultKey) {
    byte[] key = vaultKey.bytes();
    try {
      byte[] iv = config.randomProvider().randomBytes(config.ivLength());
      byte[] ciphertext = config.cipher().encrypt(toUtf8(plaintext), key, iv);
      return B64.encodeToString(concat(new byte[]{CURRENT_TAG}, iv, ciphertext));
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * Decrypts a current-format blob, tagged or untagged.
   *
   * @param blob     the base64 blob
   * @param vaultKey the unlocked vault key
   * @return the plaintext
   * @throws VaultException {@code INVALID_FORMAT} if the blob is not base64, is a tagged legacy
   *                        blob, or is shorter than an IV and one block; {@code DECRYPTION_FAILED}
   *                        on bad padding or a plaintext that is not valid UTF-8
   */
  public String decodeCurrent(String blob, VaultKey vaultKey) {
    byte[] bytes = decode(blob);
    int offset = 0;
    if (isTagged(bytes)) {
      if (bytes[0] == LEGACY_TAG) {
        throw new VaultException(VaultErrorKind.INVALID_FORMAT, "Blob is in the legacy format");
      }
      if (bytes[0] == CURRENT_TAG) {
        offset = 1;
      }
    }
    int ivLength = config.ivLength();
    int minimum = ivLength + config.blockSize();
    if (bytes.length - offset < minimum) {
      throw new VaultException(VaultErrorKind.INVALID_FORMAT,
          "Blob too short: need at least " + (offset + minimum) + " bytes, got " + bytes.length);
    }
    byte[] iv = ByteUtils.slice(bytes, offset, ivLength);
    byte[] ciphertext = ByteUtils.tail(bytes, offset + ivLength);
    byte[] key = vaultKey.bytes();
    try {
      return fromUtf8(config.cipher().decrypt(ciphertext, key, iv));
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * Encrypts under a key derived from the secret and a fresh per-blob salt. Only kept so legacy
   * data can be produced for migration and compatibility checks; new writes use
   * {@link #encodeCurrent(String, VaultKey)}.
   *
   * @param plaintext the plaintext
   * @param secret    the master password, UTF-8
   * @return the base64 blob
   */
  public String encodeLegacy(String plaintext, byte[] secret) {
    byte[] salt = config.randomProvider().randomBytes(VaultConfig.SALT_LENGTH);
    byte[] iv = config.randomProvider().randomBytes(config.ivLength());
    byte[] key = config.keyDerivation().derive(secret, salt, config.keyLength());
    try {
      byte[] ciphertext = config.cipher().encrypt(toUtf8(plaintext), key, iv);
      return B64.encodeToString(concat(new byte[]{LEGACY_TAG}, salt, iv, ciphertext));
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * Decrypts a legacy blob, tagged or untagged, running the KDF with the embedded salt.
   *
   * @param blob   the base64 blob
   * @param secret the master password, UTF-8
   * @return the plaintext
   * @throws VaultException {@code INVALID_FORMAT} if the blob is not base64, is a tagged current
   *                        blob, or is too short for salt, IV and one block;
   *                        {@code DECRYPTION_FAILED} otherwise
   */
  public String decodeLegacy(String blob, byte[] secret) {
    byte[] bytes = decode(blob);
    int offset = 0;
    if (isTagged(bytes)) {
      if (bytes[0] == CURRENT_TAG) {
        throw new VaultException(VaultErrorKind.INVALID_FORMAT, "Blob is in the current format");
      }
      if (bytes[0] == LEGACY_TAG) {
        offset = 1;
      }
    }
    int ivLength = config.ivLength();
    int header = VaultConfig.SALT_LENGTH + ivLength;
    if (bytes.length - offset < header + config.blockSize()) {
      throw new VaultException(VaultErrorKind.INVALID_FORMAT, "Blob too short: need at least "
          + (offset + header + config.blockSize()) + " bytes, got " + bytes.length);
    }
    byte[] salt = ByteUtils.slice(bytes, offset, VaultConfig.SALT_LENGTH);
    byte[] iv = ByteUtils.slice(bytes, offset + VaultConfig.SALT_LENGTH, ivLength);
    byte[] ciphertext = ByteUtils.tail(bytes, offset + header);
    byte[] key = config.keyDerivation().derive(secret, salt, config.keyLength());
    try {
      return fromUtf8(config.cipher().decrypt(ciphertext, key, iv));
    } finally {
      ByteUtils.wipe(key);
    }
  }

  private boolean isTagged(byte[] bytes) {
    return bytes.length % config.blockSize() == 1;
  }

  private static byte[] decode(String blob) {
    byte[] bytes = tryDecode(blob);
    if (bytes == null) {
      throw new VaultException(VaultErrorKind.INVALID_FORMAT, "Blob is not valid base64");
    }
    return bytes;
  }

  private static byte[] tryDecode(String blob) {
    if (blob == null) {
      return null;
    }
    try {
      return B64D.decode(blob);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static byte[] toUtf8(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext must not be null");
    }
    return plaintext.getBytes(StandardCharsets.UTF_8);
  }

  private static String fromUtf8(byte[] plaintext) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plaintext))
          .toString();
    } catch (CharacterCodingException e) {
      throw new VaultException(VaultErrorKind.DECRYPTION_FAILED, "Plaintext is not valid UTF-8", e);
    } finally {
      ByteUtils.wipe(plaintext);
    }
  }
}
