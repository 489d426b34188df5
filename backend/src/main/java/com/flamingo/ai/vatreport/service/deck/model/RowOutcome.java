package com.flamingo.ai.vatreport.service.deck.model;

/**
 * Result of mapping a single table row: either an accepted record or the reason it was skipped.
 *
 * @param value the accepted record, null when skipped
 * @param skipReason why the row was skipped, null when accepted
 * @param <T> record type
 */
public record RowOutcome<T>(T value, String skipReason) {

  public static <T> RowOutcome<T> accepted(T value) {
    return new RowOutcome<>(value, null);
  }

  public static <T> RowOutcome<T> skipped(String reason) {
    return new RowOutcome<>(null, reason);
  }

  public boolean isAccepted() {
    return value != null;
  }
}
