package com.cloudsec.transformer;

import java.util.Collection;

/** Levenshtein string distance, used to suggest the nearest known name for a misspelled one */
public class StringDistance {
  /** Default similarity cutoff used by {@link #closest(String, Collection)} */
  public static final double DEFAULT_CUTOFF = 0.6;

  /**
   * Calculate similarity ratio between two strings
   *
   * <p>1.0 means identical strings, 0.0 means no characters in common position-wise.
   *
   * @param x First string
   * @param y Second string
   * @return Calculated ratio
   */
  public static double similarity(String x, String y) {
    if ((x == null) || (y == null)) {
      throw new IllegalArgumentException("similarity called with null string values");
    }
    int maxlen = Math.max(x.length(), y.length());
    if (maxlen == 0) {
      return 1.0;
    }
    return 1.0 - (calculate(x, y) / (double) maxlen);
  }

  /**
   * Return string distance value between two strings
   *
   * @param x First string
   * @param y Second string
   * @return Calculated distance
   */
  public static int calculate(String x, String y) {
    if ((x == null) || (y == null)) {
      throw new IllegalArgumentException("calculate called with null string values");
    }
    int[] prev = new int[y.length() + 1];
    int[] cur = new int[y.length() + 1];
    for (int j = 0; j <= y.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= x.length(); i++) {
      cur[0] = i;
      for (int j = 1; j <= y.length(); j++) {
        int cost = x.charAt(i - 1) == y.charAt(j - 1) ? 0 : 1;
        cur[j] = Math.min(Math.min(prev[j - 1] + cost, prev[j] + 1), cur[j - 1] + 1);
      }
      int[] t = prev;
      prev = cur;
      cur = t;
    }
    return prev[y.length()];
  }

  /**
   * Find the candidate most similar to name, using the default cutoff
   *
   * @param name Name to look up
   * @param candidates Known names
   * @return Closest candidate, or null if none is similar enough
   */
  public static String closest(String name, Collection<String> candidates) {
    return closest(name, candidates, DEFAULT_CUTOFF);
  }

  /**
   * Find the candidate most similar to name
   *
   * <p>Ties are resolved in favor of the candidate seen first.
   *
   * @param name Name to look up
   * @param candidates Known names
   * @param cutoff Minimum similarity a candidate must reach
   * @return Closest candidate, or null if none reaches the cutoff
   */
  public static String closest(String name, Collection<String> candidates, double cutoff) {
    if (name == null || candidates == null) {
      return null;
    }
    String best = null;
    double bestScore = cutoff;
    for (String c : candidates) {
      double s = similarity(name, c);
      if (s >= bestScore && (best == null || s > bestScore)) {
        best = c;
        bestScore = s;
      }
    }
    return best;
  }
}
