package com.codeheadsystems.pbkdf2.common;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.Arrays;

/**
 * Utility methods for handling byte arrays that carry secret material.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Overwrites every given array with zeros. Null arrays are skipped.
   *
   * @param arrays the arrays to clear
   */
  public static void wipe(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        java.util.Arrays.fill(arr, (byte) 0);
      }
    }
  }

  /**
   * Returns true if every byte of the array is zero.
   *
   * @param array the array
   * @return true when wiped
   */
  public static boolean isWiped(byte[] array) {
    int acc = 0;
    for (byte b : array) {
      acc |= b;
    }
    return acc == 0;
  }

  /**
   * Compares two arrays in time independent of where they first differ.
   * Arrays of unequal length are unequal immediately; lengths are not secret.
   *
   * @param expected the expected bytes
   * @param actual   the actual bytes
   * @return true if both arrays hold the same bytes
   */
  public static boolean constantTimeEquals(byte[] expected, byte[] actual) {
    if (expected == null || actual == null || expected.length != actual.length) {
      return false;
    }
    return Arrays.constantTimeAreEqual(expected, actual);
  }

  /**
   * Encodes text as UTF-8 into a freshly allocated array owned by the caller, who must wipe it.
   *
   * @param text the text
   * @return the byte [ ]
   */
  public static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
