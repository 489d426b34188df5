package com.flamingo.ai.vatreport.service.deck.model;

import java.util.List;

/**
 * Output of entity grouping.
 *
 * @param groups groups in order of their title slides
 * @param warnings one entry per slide dropped because no entity group was open
 */
public record GroupingResult(List<EntityGroup> groups, List<String> warnings) {

  public GroupingResult {
    groups = List.copyOf(groups);
    warnings = List.copyOf(warnings);
  }
}
