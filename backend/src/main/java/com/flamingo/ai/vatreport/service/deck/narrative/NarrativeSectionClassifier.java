package com.flamingo.ai.vatreport.service.deck.narrative;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.service.deck.model.NarrativeContent;
import com.flamingo.ai.vatreport.service.deck.model.NarrativeSection;
import com.flamingo.ai.vatreport.service.deck.model.StatusTokens;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Assigns plain slide paragraphs to narrative sections.
 *
 * <p>A section header paragraph switches the current section; every other paragraph is appended to
 * whichever section is current, starting with {@link NarrativeSection#STATUS_SUMMARY}. Header
 * patterns are tried in a fixed order and the first match wins.
 */
@Component
@RequiredArgsConstructor
public class NarrativeSectionClassifier {

  private static final int BANNER_SCAN_DEPTH = 5;
  private static final int SHORT_BANNER_LENGTH = 30;

  private static final String DECK_TITLE_MARKER = "VAT REPORT";
  private static final String OVERALL_STATUS_MARKER = "OVERALL STATUS";
  private static final String WEEK_ENDING_MARKER = "WEEK ENDING";

  private static final Pattern LEADING_PAGE_NUMBER = Pattern.compile("^\\d{1,2}\\s");
  private static final Pattern BARE_YEAR = Pattern.compile("^\\d{4}$");

  /** Table header labels whose text also shows up as paragraphs. */
  private static final Set<String> TABLE_HEADER_LABELS =
      Set.of(
          "STATUS OVERALL", "RAISED BY", "DESCRIPTION", "IMPACT", "DATE RISK BECOMES ISSUE",
          "STATUS", "OWNER", "IMPACT RATING", "LIKELIHOOD", "MITIGATION", "COMMENTS",
          "RISK RATING", "ISSUE RATING", "RISKS", "ISSUES", "RISK", "ISSUE", "PEOPLE", "PROCESS",
          "PEOPLE PROCESS", "WEEK ENDING");

  private static final Set<String> STANDALONE_LABELS =
      Set.of(
          "OPEN OPPS",
          "OPEN OPPS ACTIONS",
          "BIG PLAYS",
          "BIG PLAY",
          "ACCOUNT GOALS",
          "RELATIONSHIPS",
          "RESEARCH",
          "STATUS OVERALL");

  private record HeaderRule(Pattern pattern, NarrativeSection section) {}

  private static final List<HeaderRule> HEADER_RULES =
      List.of(
          new HeaderRule(
              Pattern.compile("^APPROACH TO\\b.*(?:SHORTFALL|TARGET)"), NarrativeSection.APPROACH),
          new HeaderRule(
              Pattern.compile("^OTHER VAT\\b|^OTHER ACTIVITIES"), NarrativeSection.OTHER),
          new HeaderRule(Pattern.compile("^OPEN OPP"), NarrativeSection.OPEN_OPPS),
          new HeaderRule(Pattern.compile("^BIG PLAY"), NarrativeSection.BIG_PLAYS),
          new HeaderRule(Pattern.compile("^ACCOUNT GOAL"), NarrativeSection.ACCOUNT_GOALS),
          new HeaderRule(Pattern.compile("^RELATIONSHIP"), NarrativeSection.RELATIONSHIPS),
          new HeaderRule(Pattern.compile("^RESEARCH"), NarrativeSection.RESEARCH));

  private final DeckParserConfig config;

  /**
   * Classifies the paragraphs of one slide.
   *
   * @param paragraphs slide paragraphs in document order
   * @return text per section, newline-joined
   */
  public NarrativeContent classify(List<String> paragraphs) {
    Map<NarrativeSection, List<String>> lines = new EnumMap<>(NarrativeSection.class);
    for (NarrativeSection section : NarrativeSection.values()) {
      lines.put(section, new ArrayList<>());
    }
    NarrativeSection current = NarrativeSection.STATUS_SUMMARY;
    int colonWindow = config.getNarrative().getHeaderColonWindow();

    for (int i = bannerLength(paragraphs); i < paragraphs.size(); i++) {
      String line = paragraphs.get(i).trim();
      if (line.isEmpty() || isNoise(line)) {
        continue;
      }
      String upper = line.toUpperCase(Locale.ROOT);

      Optional<NarrativeSection> header = detectHeader(upper);
      if (header.isPresent()) {
        current = header.get();
        int colon = line.indexOf(':');
        if (colon >= 0 && colon < colonWindow) {
          String inline = line.substring(colon + 1).trim();
          if (!inline.isEmpty()) {
            lines.get(current).add(inline);
          }
        } else {
          lines.get(current).add(line);
        }
        continue;
      }

      if (STANDALONE_LABELS.contains(upper)) {
        continue;
      }
      lines.get(current).add(line);
    }

    Map<NarrativeSection, String> joined = new EnumMap<>(NarrativeSection.class);
    lines.forEach((section, sectionLines) -> joined.put(section, join(sectionLines)));
    return new NarrativeContent(joined);
  }

  /**
   * Number of leading paragraphs that form the slide banner: everything up to the last of the
   * first five paragraphs that carries the deck title, the overall status marker, a page number
   * or a bare year.
   */
  static int bannerLength(List<String> paragraphs) {
    int skip = 0;
    for (int i = 0; i < Math.min(BANNER_SCAN_DEPTH, paragraphs.size()); i++) {
      String paragraph = paragraphs.get(i);
      String upper = paragraph.toUpperCase(Locale.ROOT);
      if (upper.contains(DECK_TITLE_MARKER)
          || upper.contains(OVERALL_STATUS_MARKER)
          || LEADING_PAGE_NUMBER.matcher(paragraph).find()
          || BARE_YEAR.matcher(paragraph.trim()).matches()) {
        skip = i + 1;
      }
    }
    return skip;
  }

  static boolean isNoise(String line) {
    String upper = line.trim().toUpperCase(Locale.ROOT);
    if (upper.isEmpty()) {
      return false;
    }
    return StatusTokens.isBareToken(upper)
        || TABLE_HEADER_LABELS.contains(upper)
        || upper.startsWith(WEEK_ENDING_MARKER)
        || (upper.contains(DECK_TITLE_MARKER) && upper.length() < SHORT_BANNER_LENGTH);
  }

  static Optional<NarrativeSection> detectHeader(String upperLine) {
    return HEADER_RULES.stream()
        .filter(rule -> rule.pattern().matcher(upperLine).find())
        .map(HeaderRule::section)
        .findFirst();
  }

  private static String join(List<String> sectionLines) {
    return String.join("\n", sectionLines).trim();
  }
}
