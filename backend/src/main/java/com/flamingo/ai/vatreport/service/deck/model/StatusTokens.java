package com.flamingo.ai.vatreport.service.deck.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The RAG status vocabulary: {@code GREEN}, {@code AMBER}, {@code RED} and {@code N/A}. */
public final class StatusTokens {

  public static final String GREEN = "GREEN";
  public static final String AMBER = "AMBER";
  public static final String RED = "RED";
  public static final String NOT_APPLICABLE = "N/A";

  private static final Set<String> TOKENS = Set.of(GREEN, AMBER, RED, NOT_APPLICABLE);

  // Word-bounded so that e.g. "REDUCED" does not read as RED
  private static final Pattern TOKEN_PATTERN =
      Pattern.compile("(?<![A-Z0-9])(GREEN|AMBER|RED|N/A)(?![A-Z0-9])");

  private StatusTokens() {}

  /**
   * Finds the first status token in the given text, ignoring case.
   *
   * @param text any text, may be null
   * @return the upper-case token, or empty when none occurs
   */
  public static Optional<String> findFirst(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = TOKEN_PATTERN.matcher(text.toUpperCase(Locale.ROOT));
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  /** Returns true when the trimmed text is exactly one status token, ignoring case. */
  public static boolean isBareToken(String text) {
    return text != null && TOKENS.contains(text.trim().toUpperCase(Locale.ROOT));
  }
}
