package com.flamingo.ai.vatreport.service.deck;

import com.flamingo.ai.vatreport.service.deck.model.DeckParseResult;
import com.flamingo.ai.vatreport.service.deck.model.ReportPreview;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import java.util.List;

/**
 * Turns an uploaded VAT report deck (PPTX) into per-entity report records.
 *
 * <p>Implementations are stateless; independent decks may be parsed concurrently.
 */
public interface DeckParsingService {

  /**
   * Parses a deck into one report per entity, in the order the entities appear.
   *
   * @param deck raw PPTX bytes
   * @return reports, summary line and warnings for dropped slides
   * @throws com.flamingo.ai.vatreport.exception.ArchiveException if the deck cannot be opened
   */
  DeckParseResult parse(byte[] deck);

  /**
   * Parses a deck and condenses each report for display before import.
   *
   * @param deck raw PPTX bytes
   * @return one preview per report
   */
  List<ReportPreview> preview(byte[] deck);

  /**
   * Extracts paragraphs and tables of every slide without classifying them. Used to troubleshoot
   * decks that do not produce the expected reports.
   *
   * @param deck raw PPTX bytes
   * @return slides in numeric order
   */
  List<SlideContent> inspectSlides(byte[] deck);
}
