package com.flamingo.ai.vatreport.service.deck.model;

import java.util.List;

/**
 * Outcome of parsing one deck.
 *
 * @param reports one report per entity, in title-slide order
 * @param summary per-report summary lines joined with {@code "; "}
 * @param warnings slides that were dropped without contributing to any report
 */
public record DeckParseResult(List<ParsedReport> reports, String summary, List<String> warnings) {

  public DeckParseResult {
    reports = List.copyOf(reports);
    warnings = List.copyOf(warnings);
  }
}
