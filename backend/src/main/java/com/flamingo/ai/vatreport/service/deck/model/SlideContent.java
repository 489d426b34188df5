package com.flamingo.ai.vatreport.service.deck.model;

import java.util.List;

/**
 * One parsed slide. Ordering of both paragraphs and tables follows the slide markup and is never
 * re-sorted.
 *
 * @param index 1-based slide number
 * @param paragraphs decoded, non-blank paragraph texts
 * @param tables tables in document order
 * @param byteSize length of the slide markup, used by the title-slide heuristic
 */
public record SlideContent(
    int index, List<String> paragraphs, List<SlideTable> tables, int byteSize) {

  public SlideContent {
    paragraphs = List.copyOf(paragraphs);
    tables = List.copyOf(tables);
  }

  public String firstParagraph() {
    return paragraphs.isEmpty() ? "" : paragraphs.get(0);
  }

  public boolean hasTables() {
    return !tables.isEmpty();
  }

  public boolean isBlank() {
    return paragraphs.isEmpty() && tables.isEmpty();
  }

  /** Leading paragraphs, at most {@code depth} of them. */
  public List<String> leadingParagraphs(int depth) {
    return paragraphs.subList(0, Math.min(depth, paragraphs.size()));
  }
}
