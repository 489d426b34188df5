package com.flamingo.ai.vatreport.service.deck;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.exception.ArchiveException;
import com.flamingo.ai.vatreport.service.deck.archive.SlideArchiveReader;
import com.flamingo.ai.vatreport.service.deck.assemble.ReportAssembler;
import com.flamingo.ai.vatreport.service.deck.assemble.ReportDateExtractor;
import com.flamingo.ai.vatreport.service.deck.classify.SlideClassifier;
import com.flamingo.ai.vatreport.service.deck.extract.SlideXmlExtractor;
import com.flamingo.ai.vatreport.service.deck.group.EntityGrouper;
import com.flamingo.ai.vatreport.service.deck.model.ClassifiedSlide;
import com.flamingo.ai.vatreport.service.deck.model.DeckParseResult;
import com.flamingo.ai.vatreport.service.deck.model.EntityGroup;
import com.flamingo.ai.vatreport.service.deck.model.GroupingResult;
import com.flamingo.ai.vatreport.service.deck.model.ParsedReport;
import com.flamingo.ai.vatreport.service.deck.model.ReportPreview;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the extraction pipeline: read archive, extract slides, classify, group by entity, assemble
 * one report per group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeckParsingServiceImpl implements DeckParsingService {

  private final SlideArchiveReader archiveReader;
  private final SlideXmlExtractor slideXmlExtractor;
  private final SlideClassifier slideClassifier;
  private final EntityGrouper entityGrouper;
  private final ReportAssembler reportAssembler;
  private final ReportDateExtractor reportDateExtractor;
  private final DeckParserConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "deck.parse", description = "Time to parse a VAT report deck")
  public DeckParseResult parse(byte[] deck) {
    try {
      List<SlideContent> slides = inspectSlides(deck);

      List<ClassifiedSlide> classified = slides.stream().map(slideClassifier::classify).toList();
      GroupingResult grouping = entityGrouper.group(classified);
      Optional<LocalDate> deckDate =
          reportDateExtractor.extract(slides.get(0).paragraphs(), List.of());

      List<ParsedReport> reports = new ArrayList<>();
      for (EntityGroup group : grouping.groups()) {
        reports.add(reportAssembler.assemble(group, deckDate));
      }
      String summary = ReportAssembler.summarize(reports);

      if (!grouping.warnings().isEmpty()) {
        log.warn(
            "{} slide(s) dropped before the first entity title slide",
            grouping.warnings().size());
      }
      log.info("Parsed deck: {} slides, {} reports ({})", slides.size(), reports.size(), summary);
      meterRegistry.counter("deck.parse.success").increment();
      meterRegistry.counter("deck.reports.extracted").increment(reports.size());
      return new DeckParseResult(reports, summary, grouping.warnings());
    } catch (ArchiveException e) {
      log.error("Failed to parse deck [{}]: {}", e.getCode(), e.getMessage());
      meterRegistry.counter("deck.parse.failure", "error_code", e.getCode()).increment();
      throw e;
    }
  }

  @Override
  public List<ReportPreview> preview(byte[] deck) {
    int summaryLength = config.getNarrative().getPreviewSummaryLength();
    return parse(deck).reports().stream()
        .map(report -> ReportPreview.of(report, summaryLength))
        .toList();
  }

  @Override
  public List<SlideContent> inspectSlides(byte[] deck) {
    return archiveReader.readSlides(deck).stream().map(slideXmlExtractor::extract).toList();
  }
}
