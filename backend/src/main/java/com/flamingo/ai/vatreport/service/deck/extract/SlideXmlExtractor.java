package com.flamingo.ai.vatreport.service.deck.extract;

import com.flamingo.ai.vatreport.service.deck.model.RawSlide;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recovers paragraphs and tables from DrawingML slide markup.
 *
 * <p>Works directly on the markup with patterns instead of a DOM so that a fragment with no
 * matching inner content simply yields an empty string or row. Paragraphs nested inside table
 * cells are reported as paragraphs too, exactly as they occur in the markup.
 */
@Component
@Slf4j
public class SlideXmlExtractor {

  private static final Pattern PARAGRAPH =
      Pattern.compile("<a:p(?:\\s[^>]*)?>(.*?)</a:p>", Pattern.DOTALL);
  private static final Pattern TEXT_RUN = Pattern.compile("<a:t(?:\\s[^>]*)?>([^<]*)</a:t>");
  private static final Pattern TABLE = Pattern.compile("<a:tbl>(.*?)</a:tbl>", Pattern.DOTALL);
  private static final Pattern TABLE_ROW =
      Pattern.compile("<a:tr\\b[^>]*>(.*?)</a:tr>", Pattern.DOTALL);
  private static final Pattern TABLE_CELL =
      Pattern.compile("<a:tc\\b[^>]*>(.*?)</a:tc>", Pattern.DOTALL);

  /**
   * Parses one slide.
   *
   * @param rawSlide slide markup and index
   * @return paragraphs, tables and markup size of the slide
   */
  public SlideContent extract(RawSlide rawSlide) {
    String xml = rawSlide.xml() == null ? "" : rawSlide.xml();
    List<String> paragraphs = extractParagraphs(xml);
    List<SlideTable> tables = extractTables(xml);
    log.debug(
        "Slide {}: {} paragraphs, {} tables, {} chars",
        rawSlide.index(),
        paragraphs.size(),
        tables.size(),
        xml.length());
    return new SlideContent(rawSlide.index(), paragraphs, tables, xml.length());
  }

  /** Decoded text of every non-blank paragraph, in markup order. */
  public List<String> extractParagraphs(String xml) {
    List<String> paragraphs = new ArrayList<>();
    Matcher paragraph = PARAGRAPH.matcher(xml);
    while (paragraph.find()) {
      String text = XmlText.decode(joinRuns(paragraph.group(1), ""));
      if (!text.isBlank()) {
        paragraphs.add(text);
      }
    }
    return paragraphs;
  }

  /** Every table as rows of trimmed, decoded cell text. */
  public List<SlideTable> extractTables(String xml) {
    List<SlideTable> tables = new ArrayList<>();
    Matcher table = TABLE.matcher(xml);
    while (table.find()) {
      List<List<String>> rows = new ArrayList<>();
      Matcher row = TABLE_ROW.matcher(table.group(1));
      while (row.find()) {
        List<String> cells = new ArrayList<>();
        Matcher cell = TABLE_CELL.matcher(row.group(1));
        while (cell.find()) {
          cells.add(XmlText.decode(joinRuns(cell.group(1), " ").trim()));
        }
        rows.add(cells);
      }
      tables.add(SlideTable.of(rows));
    }
    return tables;
  }

  private static String joinRuns(String fragment, String separator) {
    List<String> runs = new ArrayList<>();
    Matcher run = TEXT_RUN.matcher(fragment);
    while (run.find()) {
      runs.add(run.group(1));
    }
    return String.join(separator, runs);
  }
}
