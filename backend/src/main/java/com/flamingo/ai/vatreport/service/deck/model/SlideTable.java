package com.flamingo.ai.vatreport.service.deck.model;

import java.util.List;

/**
 * A table recovered from slide markup: rows of cell strings in document order.
 *
 * <p>Cells may be empty strings but are never null. Rows are not required to share a width; the
 * width of the first row is what table classification looks at.
 *
 * @param rows ordered rows, each an ordered list of cell text
 */
public record SlideTable(List<List<String>> rows) {

  public SlideTable {
    rows = rows.stream().map(List::copyOf).toList();
  }

  public static SlideTable of(List<List<String>> rows) {
    return new SlideTable(rows);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int rowCount() {
    return rows.size();
  }

  /** Width of the header row, 0 for an empty table. */
  public int columnCount() {
    return rows.isEmpty() ? 0 : rows.get(0).size();
  }

  public List<String> header() {
    return rows.isEmpty() ? List.of() : rows.get(0);
  }

  public List<List<String>> bodyRows() {
    return rows.size() < 2 ? List.of() : rows.subList(1, rows.size());
  }

  /** Returns the trimmed cell text, or an empty string when the row is shorter. */
  public static String cell(List<String> row, int column) {
    if (column >= row.size() || row.get(column) == null) {
      return "";
    }
    return row.get(column).trim();
  }

  public static boolean isBlankRow(List<String> row) {
    return row.stream().allMatch(c -> c == null || c.isBlank());
  }
}
