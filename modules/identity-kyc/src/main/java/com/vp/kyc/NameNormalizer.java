package com.vp.kyc;

import java.util.Locale;
import java.util.regex.Pattern;

/** Canonical form of a free-text name for comparison: lower case, no ASCII punctuation. */
public final class NameNormalizer {

  private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");

  private NameNormalizer() {
  }

  /** Idempotent; null and empty both map to "". Not meant for URLs, addresses or phones. */
  public static String normalize(String s) {
    if (s == null || s.isEmpty()) return "";
    return PUNCTUATION.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("");
  }
}
