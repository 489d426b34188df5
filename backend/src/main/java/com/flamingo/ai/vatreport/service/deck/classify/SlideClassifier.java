package com.flamingo.ai.vatreport.service.deck.classify;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.service.deck.model.ClassifiedSlide;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import com.flamingo.ai.vatreport.service.deck.model.SlideKind;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Labels each slide with its role in the deck.
 *
 * <p>Rules are evaluated in this order:
 *
 * <ol>
 *   <li>slide 1 carrying both the deck title and sub-title markers is the deck cover
 *   <li>a slide with neither paragraphs nor tables is empty
 *   <li>a small, table-free slide whose first paragraph resolves to an entity is a title slide
 *   <li>a slide starting with the planner status marker and holding a table is a status update
 *   <li>anything else is content
 * </ol>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlideClassifier {

  static final String DECK_TITLE_MARKER = "VAT REPORT";
  static final String DECK_SUBTITLE_MARKER = "SALES COMMITTEE";
  static final String STATUS_UPDATE_MARKER = "PLANNER STATUS";

  private final DeckParserConfig config;
  private final EntityNameResolver entityNameResolver;

  public ClassifiedSlide classify(SlideContent slide) {
    String first = slide.firstParagraph().trim().toUpperCase(Locale.ROOT);

    if (slide.index() == 1
        && first.contains(DECK_TITLE_MARKER)
        && first.contains(DECK_SUBTITLE_MARKER)) {
      return ClassifiedSlide.of(slide, SlideKind.DECK_COVER);
    }
    if (slide.isBlank()) {
      return ClassifiedSlide.of(slide, SlideKind.EMPTY);
    }

    if (isTitleCandidate(slide)) {
      Optional<String> entityName = entityNameResolver.resolve(slide.firstParagraph());
      if (entityName.isPresent()) {
        return ClassifiedSlide.title(slide, entityName.get());
      }
      log.debug(
          "Slide {} looks like a title slide but '{}' is not a known entity",
          slide.index(),
          slide.firstParagraph());
    }

    if (first.startsWith(STATUS_UPDATE_MARKER)) {
      if (slide.hasTables()) {
        return ClassifiedSlide.of(slide, SlideKind.STATUS_UPDATE);
      }
      log.debug("Slide {} is a status update without a table; treating as content", slide.index());
    }
    return ClassifiedSlide.of(slide, SlideKind.CONTENT);
  }

  private boolean isTitleCandidate(SlideContent slide) {
    DeckParserConfig.Classification rules = config.getClassification();
    return slide.paragraphs().size() <= rules.getTitleSlideMaxParagraphs()
        && slide.byteSize() < rules.getTitleSlideMaxMarkupSize()
        && !slide.hasTables();
  }
}
