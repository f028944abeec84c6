package com.codeheadsystems.locker.crypto.common;

import java.util.Arrays;

/**
 * Utility methods for assembling and splitting ciphertext blobs.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Copies {@code length} bytes starting at {@code offset}.
   *
   * @param bytes  the source
   * @param offset the start offset
   * @param length the number of bytes
   * @return the byte [ ]
   * @throws IllegalArgumentException if the range is outside the source
   */
  public static byte[] slice(byte[] bytes, int offset, int length) {
    if (offset < 0 || length < 0 || bytes.length < offset + length) {
      throw new IllegalArgumentException("Range [" + offset + ", " + (offset + length)
          + ") outside of " + bytes.length + " bytes");
    }
    return Arrays.copyOfRange(bytes, offset, offset + length);
  }

  /**
   * Copies everything from {@code offset} to the end.
   *
   * @param bytes  the source
   * @param offset the start offset
   * @return the byte [ ]
   */
  public static byte[] tail(byte[] bytes, int offset) {
    return slice(bytes, offset, bytes.length - offset);
  }

  /**
   * Overwrites the array with zeros. Null is ignored.
   *
   * @param bytes the array to clear
   */
  public static void wipe(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
