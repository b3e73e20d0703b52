package io.intellixity.querygate.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Hashes() {}

  public static String sha256Hex(String s) {
    return sha256Hex(s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8));
  }

  public static String sha256Hex(byte[] bytes) {
    try {
      byte[] d = MessageDigest.getInstance("SHA-256").digest(bytes);
      char[] out = new char[d.length * 2];
      for (int i = 0; i < d.length; i++) {
        out[i * 2] = HEX[(d[i] >> 4) & 0xF];
        out[i * 2 + 1] = HEX[d[i] & 0xF];
      }
      return new String(out);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
