package com.flamingo.ai.vatreport.service.deck.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Values read from a 3-column status grid.
 *
 * @param overallStatus RAG token from the header cell, empty when absent
 * @param summary summary lines, newline-joined, empty when absent
 * @param categoryStatuses RAG token per category row found
 */
public record StatusGrid(
    String overallStatus, String summary, Map<StatusCategory, String> categoryStatuses) {

  public StatusGrid {
    EnumMap<StatusCategory, String> copy = new EnumMap<>(StatusCategory.class);
    copy.putAll(categoryStatuses);
    categoryStatuses = Collections.unmodifiableMap(copy);
  }

  public String categoryStatus(StatusCategory category) {
    return categoryStatuses.getOrDefault(category, "");
  }
}
