package com.flamingo.ai.vatreport.service.deck.assemble;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Finds the report date written on a slide, either as {@code "15 July, 2024"} / {@code "1 Jul
 * 2024"} or as day-first {@code "15/7/2024"}.
 */
@Component
@RequiredArgsConstructor
public class ReportDateExtractor {

  private static final Pattern TEXT_DATE =
      Pattern.compile("(\\d{1,2})\\s+([A-Za-z]+),?\\s+(\\d{4})");
  private static final Pattern SLASH_DATE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");
  private static final int MIN_MONTH_ABBREVIATION = 3;

  private final DeckParserConfig config;

  /**
   * Scans the leading paragraphs of a slide, then the paragraphs of the entity's title slide.
   *
   * @param paragraphs slide paragraphs
   * @param titleParagraphs title slide paragraphs
   * @return the first date that parses, or empty
   */
  public Optional<LocalDate> extract(List<String> paragraphs, List<String> titleParagraphs) {
    int depth = config.getClassification().getHeaderScanDepth();
    List<String> candidates =
        new ArrayList<>(paragraphs.subList(0, Math.min(depth, paragraphs.size())));
    candidates.addAll(titleParagraphs);

    for (String paragraph : candidates) {
      Optional<LocalDate> date = parseTextDate(paragraph).or(() -> parseSlashDate(paragraph));
      if (date.isPresent()) {
        return date;
      }
    }
    return Optional.empty();
  }

  /** Parses the first {@code D Month[,] YYYY} date in the text. */
  public static Optional<LocalDate> parseTextDate(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = TEXT_DATE.matcher(text);
    while (matcher.find()) {
      Optional<Month> month = parseMonth(matcher.group(2));
      if (month.isPresent()) {
        Optional<LocalDate> date =
            toDate(
                Integer.parseInt(matcher.group(3)),
                month.get().getValue(),
                Integer.parseInt(matcher.group(1)));
        if (date.isPresent()) {
          return date;
        }
      }
    }
    return Optional.empty();
  }

  /** Parses the first day-first {@code D/M/YYYY} date in the text. */
  public static Optional<LocalDate> parseSlashDate(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = SLASH_DATE.matcher(text);
    while (matcher.find()) {
      Optional<LocalDate> date =
          toDate(
              Integer.parseInt(matcher.group(3)),
              Integer.parseInt(matcher.group(2)),
              Integer.parseInt(matcher.group(1)));
      if (date.isPresent()) {
        return date;
      }
    }
    return Optional.empty();
  }

  /** Full English month name or an abbreviation of at least three letters, e.g. "Sept". */
  static Optional<Month> parseMonth(String word) {
    String upper = word.toUpperCase(Locale.ROOT);
    if (upper.length() < MIN_MONTH_ABBREVIATION) {
      return Optional.empty();
    }
    for (Month month : Month.values()) {
      if (month.name().startsWith(upper)) {
        return Optional.of(month);
      }
    }
    return Optional.empty();
  }

  private static Optional<LocalDate> toDate(int year, int month, int day) {
    try {
      return Optional.of(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
