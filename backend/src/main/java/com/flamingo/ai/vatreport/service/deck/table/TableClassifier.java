package com.flamingo.ai.vatreport.service.deck.table;

import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Picks the extraction routine for a table from its column count and header text only. Rules are
 * tried in order and the first match wins.
 */
@Component
public class TableClassifier {

  static final int STATUS_GRID_COLUMNS = 3;
  static final int STATUS_GRID_MIN_ROWS = 5;
  static final int RISK_REGISTER_COLUMNS = 11;
  static final int TASK_BUCKET_COLUMNS = 7;

  private record Rule(Predicate<SlideTable> test, TableShape shape) {}

  private static final List<Rule> RULES =
      List.of(
          new Rule(
              t ->
                  t.columnCount() == STATUS_GRID_COLUMNS
                      && t.rowCount() >= STATUS_GRID_MIN_ROWS,
              TableShape.STATUS_GRID),
          new Rule(
              t -> t.columnCount() == RISK_REGISTER_COLUMNS && headerContains(t, "raised by"),
              TableShape.RISK_REGISTER),
          new Rule(
              t -> t.columnCount() == TASK_BUCKET_COLUMNS && headerContains(t, "bucket"),
              TableShape.TASK_BUCKET));

  public TableShape classify(SlideTable table) {
    if (table == null || table.isEmpty()) {
      return TableShape.UNRECOGNISED;
    }
    return RULES.stream()
        .filter(rule -> rule.test().test(table))
        .map(Rule::shape)
        .findFirst()
        .orElse(TableShape.UNRECOGNISED);
  }

  /** Whether any header cell contains the phrase, ignoring case. */
  static boolean headerContains(SlideTable table, String phrase) {
    String needle = phrase.toLowerCase(Locale.ROOT);
    return table.header().stream()
        .anyMatch(cell -> cell != null && cell.toLowerCase(Locale.ROOT).contains(needle));
  }
}
