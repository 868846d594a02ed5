package ca.gc.cra.sentinel.application.detect;

import java.nio.charset.StandardCharsets;

/** Shannon entropy helpers normalized to {@code [0,1]} (bits per byte divided by 8). */
public final class Entropy {
  private static final double LOG_2 = Math.log(2);

  private Entropy() {}

  public static double normalized(String value) {
    if (value == null || value.isEmpty()) {
      return 0d;
    }
    return normalized(value.getBytes(StandardCharsets.UTF_8));
  }

  public static double normalized(byte[] data) {
    if (data == null || data.length == 0) {
      return 0d;
    }
    int[] counts = new int[256];
    for (byte b : data) {
      counts[b & 0xFF]++;
    }
    double entropy = 0d;
    double total = data.length;
    for (int count : counts) {
      if (count > 0) {
        double p = count / total;
        entropy -= p * (Math.log(p) / LOG_2);
      }
    }
    return entropy / 8d;
  }
}
