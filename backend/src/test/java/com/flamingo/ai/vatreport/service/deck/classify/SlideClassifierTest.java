package com.flamingo.ai.vatreport.service.deck.classify;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.service.deck.model.ClassifiedSlide;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import com.flamingo.ai.vatreport.service.deck.model.SlideKind;
import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SlideClassifier Tests")
class SlideClassifierTest {

  private static final SlideTable TASK_TABLE =
      SlideTable.of(
          List.of(
              List.of("Bucket", "Task", "Progress", "Due", "Priority", "Assigned", "Labels"),
              List.of("Sales", "Close deal", "50", "2024-07-01", "High", "Alice", "GREEN")));

  private SlideClassifier classifier;

  @BeforeEach
  void setUp() {
    DeckParserConfig config = new DeckParserConfig();
    classifier = new SlideClassifier(config, new EntityNameResolver(config));
  }

  @Test
  @DisplayName("Should skip the deck cover on slide 1")
  void shouldSkipDeckCover() {
    SlideContent cover = slide(1, List.of("VAT Report - Sales Committee", "15 July 2024"), 800);

    assertThat(classifier.classify(cover).kind()).isEqualTo(SlideKind.DECK_COVER);
  }

  @Test
  @DisplayName("Should not treat a cover-like slide after slide 1 as the deck cover")
  void shouldOnlySkipCoverOnFirstSlide() {
    SlideContent slide = slide(3, List.of("VAT Report - Sales Committee"), 800);

    assertThat(classifier.classify(slide).kind()).isEqualTo(SlideKind.CONTENT);
  }

  @Test
  @DisplayName("Should classify a small slide with a known entity as a title slide")
  void shouldClassifyTitleSlide() {
    ClassifiedSlide classified = classifier.classify(slide(2, List.of("DAFF VAT"), 900));

    assertThat(classified.kind()).isEqualTo(SlideKind.TITLE);
    assertThat(classified.entityName()).isEqualTo("DAFF");
  }

  @Test
  @DisplayName("Should fall through to content when the title does not resolve")
  void shouldFallThroughForUnknownTitle() {
    ClassifiedSlide classified = classifier.classify(slide(2, List.of("Agenda"), 900));

    assertThat(classified.kind()).isEqualTo(SlideKind.CONTENT);
    assertThat(classified.entityName()).isNull();
  }

  @Test
  @DisplayName("Should not treat large or table-bearing slides as title slides")
  void shouldRequireSmallTableFreeTitle() {
    assertThat(classifier.classify(slide(2, List.of("DAFF VAT"), 3000)).kind())
        .isEqualTo(SlideKind.CONTENT);
    assertThat(classifier.classify(slide(2, List.of("DAFF", "SAU", "DISR"), 500)).kind())
        .isEqualTo(SlideKind.CONTENT);
    SlideContent withTable = new SlideContent(2, List.of("DAFF VAT"), List.of(TASK_TABLE), 500);
    assertThat(classifier.classify(withTable).kind()).isEqualTo(SlideKind.CONTENT);
  }

  @Test
  @DisplayName("Should classify planner status slides with a table as status updates")
  void shouldClassifyStatusUpdate() {
    SlideContent slide =
        new SlideContent(5, List.of("Planner Status Update", "Sales"), List.of(TASK_TABLE), 9000);

    assertThat(classifier.classify(slide).kind()).isEqualTo(SlideKind.STATUS_UPDATE);
  }

  @Test
  @DisplayName("Should treat planner status slides without a table as content")
  void shouldTreatTablelessStatusUpdateAsContent() {
    SlideContent slide = slide(5, List.of("Planner Status Update", "Nothing to report"), 4000);

    assertThat(classifier.classify(slide).kind()).isEqualTo(SlideKind.CONTENT);
  }

  @Test
  @DisplayName("Should mark slides without paragraphs or tables as empty")
  void shouldMarkEmptySlides() {
    assertThat(classifier.classify(slide(4, List.of(), 200)).kind()).isEqualTo(SlideKind.EMPTY);
  }

  private static SlideContent slide(int index, List<String> paragraphs, int size) {
    return new SlideContent(index, paragraphs, List.of(), size);
  }
}
