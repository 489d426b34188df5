package com.flamingo.ai.vatreport.service.deck.model;

/**
 * A slide with its classification.
 *
 * @param slide the parsed slide
 * @param kind classification outcome
 * @param entityName canonical entity name, only set for {@link SlideKind#TITLE}
 */
public record ClassifiedSlide(SlideContent slide, SlideKind kind, String entityName) {

  public static ClassifiedSlide title(SlideContent slide, String entityName) {
    return new ClassifiedSlide(slide, SlideKind.TITLE, entityName);
  }

  public static ClassifiedSlide of(SlideContent slide, SlideKind kind) {
    return new ClassifiedSlide(slide, kind, null);
  }
}
