package com.flamingo.ai.vatreport.service.deck.table;

import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import com.flamingo.ai.vatreport.service.deck.model.StatusCategory;
import com.flamingo.ai.vatreport.service.deck.model.StatusGrid;
import com.flamingo.ai.vatreport.service.deck.model.StatusTokens;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Reads the 3-column status grid at the top of an entity's report.
 *
 * <p>Row 0, column 0 holds the overall RAG status. Each later row is labelled in column 1: the
 * summary row, one of the category rows, or an unlabelled row whose column 0 is another line of
 * the summary.
 */
@Component
public class StatusGridExtractor {

  static final String OVERALL_STATUS_MARKER = "OVERALL STATUS";
  static final String SUMMARY_MARKER = "STATUS OVERALL";

  private record CategoryMarker(String label, StatusCategory category) {}

  // Longer labels first so that prefix matching picks the most specific one
  private static final List<CategoryMarker> CATEGORY_MARKERS =
      List.of(
          new CategoryMarker("OPEN OPPS ACTIONS", StatusCategory.OPEN_OPPS),
          new CategoryMarker("OPEN OPPS", StatusCategory.OPEN_OPPS),
          new CategoryMarker("BIG PLAYS", StatusCategory.BIG_PLAYS),
          new CategoryMarker("BIG PLAY", StatusCategory.BIG_PLAYS),
          new CategoryMarker("ACCOUNT GOALS", StatusCategory.ACCOUNT_GOALS),
          new CategoryMarker("RELATIONSHIPS", StatusCategory.RELATIONSHIPS),
          new CategoryMarker("RESEARCH", StatusCategory.RESEARCH));

  public StatusGrid extract(SlideTable table) {
    if (table.isEmpty()) {
      return new StatusGrid("", "", Map.of());
    }

    String overallStatus = StatusTokens.findFirst(SlideTable.cell(table.header(), 0)).orElse("");
    List<String> summaryLines = new ArrayList<>();
    Map<StatusCategory, String> categoryStatuses = new EnumMap<>(StatusCategory.class);

    for (List<String> row : table.bodyRows()) {
      String col0 = SlideTable.cell(row, 0);
      String col1 = SlideTable.cell(row, 1);
      String col2 = SlideTable.cell(row, 2);
      String label = col1.toUpperCase(Locale.ROOT);

      if (label.startsWith(OVERALL_STATUS_MARKER)
          || col0.toUpperCase(Locale.ROOT).startsWith(OVERALL_STATUS_MARKER)) {
        continue;
      }

      if (label.startsWith(SUMMARY_MARKER)) {
        if (summaryLines.isEmpty() && !col0.isEmpty()) {
          summaryLines.add(col0);
        }
        continue;
      }

      Optional<StatusCategory> category = matchCategory(label);
      if (category.isPresent()) {
        StatusTokens.findFirst(String.join(" ", col0, col1, col2))
            .ifPresent(status -> categoryStatuses.put(category.get(), status));
        continue;
      }

      if (!col0.isEmpty()) {
        summaryLines.add(col0);
      }
    }

    return new StatusGrid(overallStatus, String.join("\n", summaryLines), categoryStatuses);
  }

  static Optional<StatusCategory> matchCategory(String upperLabel) {
    return CATEGORY_MARKERS.stream()
        .filter(marker -> upperLabel.startsWith(marker.label()))
        .map(CategoryMarker::category)
        .findFirst();
  }
}
