package com.flamingo.ai.vatreport.service.deck.assemble;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.service.deck.model.EntityGroup;
import com.flamingo.ai.vatreport.service.deck.model.NarrativeContent;
import com.flamingo.ai.vatreport.service.deck.model.NarrativeSection;
import com.flamingo.ai.vatreport.service.deck.model.ParsedReport;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import com.flamingo.ai.vatreport.service.deck.model.StatusCategory;
import com.flamingo.ai.vatreport.service.deck.model.StatusGrid;
import com.flamingo.ai.vatreport.service.deck.model.StatusTokens;
import com.flamingo.ai.vatreport.service.deck.narrative.NarrativeSectionClassifier;
import com.flamingo.ai.vatreport.service.deck.table.RiskRegisterExtractor;
import com.flamingo.ai.vatreport.service.deck.table.StatusGridExtractor;
import com.flamingo.ai.vatreport.service.deck.table.TableClassifier;
import com.flamingo.ai.vatreport.service.deck.table.TableShape;
import com.flamingo.ai.vatreport.service.deck.table.TaskBucketExtractor;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges everything extracted from an entity group's slides into one {@link ParsedReport}.
 *
 * <p>Content slides are processed in order. Scalar fields keep the first value found; narrative
 * fields collect lines from every slide. Status update slides only contribute planner tasks, read
 * from every 7-column table on them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportAssembler {

  private static final int PLANNER_TABLE_COLUMNS = 7;

  private final TableClassifier tableClassifier;
  private final StatusGridExtractor statusGridExtractor;
  private final RiskRegisterExtractor riskRegisterExtractor;
  private final TaskBucketExtractor taskBucketExtractor;
  private final NarrativeSectionClassifier narrativeSectionClassifier;
  private final ReportDateExtractor reportDateExtractor;
  private final DeckParserConfig config;
  private final Clock clock;

  /**
   * Builds the report for one entity group.
   *
   * @param group the entity's slides
   * @param deckDate date printed on the deck's cover, used when the group's slides carry none
   * @return the assembled report
   */
  public ParsedReport assemble(EntityGroup group, Optional<LocalDate> deckDate) {
    ReportDraft draft = new ReportDraft(group.entityName());
    List<String> titleParagraphs = group.titleSlide().paragraphs();

    for (SlideContent slide : group.contentSlides()) {
      if (!draft.hasReportDate()) {
        reportDateExtractor
            .extract(slide.paragraphs(), titleParagraphs)
            .ifPresent(draft::offerReportDate);
      }
      mergeContentSlide(draft, slide);
    }

    for (SlideContent slide : group.statusUpdateSlides()) {
      for (SlideTable table : slide.tables()) {
        // Any 7-column table, whatever its header labels
        if (table.columnCount() == PLANNER_TABLE_COLUMNS) {
          draft.addPlannerTasks(taskBucketExtractor.extract(table));
        }
      }
    }

    if (!draft.hasOverallStatus()) {
      findFallbackOverallStatus(group.contentSlides()).ifPresent(draft::offerOverallStatus);
    }

    if (!draft.hasReportDate()) {
      reportDateExtractor.extract(List.of(), titleParagraphs).ifPresent(draft::offerReportDate);
    }
    if (!draft.hasReportDate()) {
      draft.offerReportDate(deckDate.orElseGet(() -> LocalDate.now(clock)));
    }

    ParsedReport report = draft.build();
    log.debug(
        "Assembled report for {} from {} content and {} status update slides",
        group.entityName(),
        group.contentSlides().size(),
        group.statusUpdateSlides().size());
    return report;
  }

  /**
   * Joins the summary line of every report with {@code "; "}.
   *
   * @param reports reports in output order
   * @return summary string, empty when there are no reports
   */
  public static String summarize(List<ParsedReport> reports) {
    return reports.stream().map(ParsedReport::summaryLine).collect(Collectors.joining("; "));
  }

  private void mergeContentSlide(ReportDraft draft, SlideContent slide) {
    String gridSummary = "";
    for (SlideTable table : slide.tables()) {
      TableShape shape = tableClassifier.classify(table);
      switch (shape) {
        case STATUS_GRID -> {
          StatusGrid grid = statusGridExtractor.extract(table);
          draft.offerOverallStatus(grid.overallStatus());
          for (StatusCategory category : StatusCategory.values()) {
            draft.offerCategoryStatus(category, grid.categoryStatus(category));
          }
          if (gridSummary.isEmpty()) {
            gridSummary = grid.summary();
          }
        }
        case RISK_REGISTER -> draft.addRisks(riskRegisterExtractor.extract(table));
        case TASK_BUCKET -> draft.addPlannerTasks(taskBucketExtractor.extract(table));
        case UNRECOGNISED ->
            log.debug(
                "Slide {}: ignoring {}x{} table",
                slide.index(),
                table.rowCount(),
                table.columnCount());
      }
    }

    NarrativeContent narrative = narrativeSectionClassifier.classify(slide.paragraphs());
    // Grid cells also appear among the paragraphs; the grid summary takes precedence
    draft.appendNarrative(
        NarrativeSection.STATUS_SUMMARY,
        gridSummary.isEmpty() ? narrative.get(NarrativeSection.STATUS_SUMMARY) : gridSummary);
    for (NarrativeSection section : NarrativeSection.values()) {
      if (section != NarrativeSection.STATUS_SUMMARY) {
        draft.appendNarrative(section, narrative.get(section));
      }
    }
  }

  private Optional<String> findFallbackOverallStatus(List<SlideContent> contentSlides) {
    int depth = config.getClassification().getHeaderScanDepth();
    for (SlideContent slide : contentSlides) {
      for (String paragraph : slide.leadingParagraphs(depth)) {
        Optional<String> status = StatusTokens.findFirst(paragraph);
        if (status.isPresent()) {
          return status;
        }
      }
    }
    return Optional.empty();
  }
}
