package com.flamingo.ai.vatreport.service.deck.model;

import java.util.List;

/**
 * Slides belonging to one entity, from its title slide up to the next title slide.
 *
 * @param entityName resolved canonical entity name
 * @param titleSlide the slide that opened the group
 * @param contentSlides ordinary content slides in document order
 * @param statusUpdateSlides planner status update slides in document order
 */
public record EntityGroup(
    String entityName,
    SlideContent titleSlide,
    List<SlideContent> contentSlides,
    List<SlideContent> statusUpdateSlides) {

  public EntityGroup {
    contentSlides = List.copyOf(contentSlides);
    statusUpdateSlides = List.copyOf(statusUpdateSlides);
  }
}
