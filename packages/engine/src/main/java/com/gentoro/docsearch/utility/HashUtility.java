package com.gentoro.docsearch.utility;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Hex digests used for content hashes and cache keys. */
public final class HashUtility {
  private HashUtility() {}

  public static String sha256(String value) {
    return digest("SHA-256", value);
  }

  public static String md5(String value) {
    return digest("MD5", value);
  }

  /** MD5 over the comma-joined components of a vector. */
  public static String md5(float[] vector) {
    StringBuilder sb = new StringBuilder(vector.length * 8);
    for (int i = 0; i < vector.length; i++) {
      if (i > 0) sb.append(',');
      sb.append(vector[i]);
    }
    return md5(sb.toString());
  }

  private static String digest(String algorithm, String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance(algorithm);
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(algorithm + " algorithm not available", e);
    }
  }
}
