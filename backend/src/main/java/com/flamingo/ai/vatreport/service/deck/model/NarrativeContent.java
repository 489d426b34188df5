package com.flamingo.ai.vatreport.service.deck.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Paragraph text grouped by narrative section. Each value is newline-joined and trimmed; sections
 * with nothing assigned read as an empty string.
 */
public record NarrativeContent(Map<NarrativeSection, String> sections) {

  public NarrativeContent {
    EnumMap<NarrativeSection, String> copy = new EnumMap<>(NarrativeSection.class);
    copy.putAll(sections);
    sections = Collections.unmodifiableMap(copy);
  }

  public String get(NarrativeSection section) {
    return sections.getOrDefault(section, "");
  }
}
