package com.flamingo.ai.vatreport.service.deck.table;

import com.flamingo.ai.vatreport.service.deck.model.Risk;
import com.flamingo.ai.vatreport.service.deck.model.RiskKind;
import com.flamingo.ai.vatreport.service.deck.model.RowOutcome;
import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps the rows of an 11-column risk or issue register onto {@link Risk} records.
 *
 * <p>Columns, in order: raised by, description, impact, date risk becomes issue, status, owner,
 * impact rating, likelihood, mitigation, comments, risk rating.
 */
@Component
@Slf4j
public class RiskRegisterExtractor {

  static final String ISSUE_HEADER = "issue rating";

  // Category header text that some decks repeat in the description column
  static final String PLACEHOLDER_DESCRIPTION = "people process";

  public List<Risk> extract(SlideTable table) {
    List<Risk> risks = new ArrayList<>();
    for (RowOutcome<Risk> outcome : mapRows(table)) {
      if (outcome.isAccepted()) {
        risks.add(outcome.value());
      } else {
        log.debug("Skipped register row: {}", outcome.skipReason());
      }
    }
    return risks;
  }

  /** Maps every body row, keeping the reason for each skipped one. */
  public List<RowOutcome<Risk>> mapRows(SlideTable table) {
    if (table.rowCount() < 2) {
      return List.of();
    }
    RiskKind kind =
        TableClassifier.headerContains(table, ISSUE_HEADER) ? RiskKind.ISSUE : RiskKind.RISK;

    List<RowOutcome<Risk>> outcomes = new ArrayList<>();
    List<List<String>> body = table.bodyRows();
    for (int i = 0; i < body.size(); i++) {
      outcomes.add(mapRow(body.get(i), i + 1, kind));
    }
    return outcomes;
  }

  private RowOutcome<Risk> mapRow(List<String> row, int rowNumber, RiskKind kind) {
    if (SlideTable.isBlankRow(row)) {
      return RowOutcome.skipped("row " + rowNumber + " is blank");
    }
    String description = SlideTable.cell(row, 1);
    if (description.isEmpty()) {
      return RowOutcome.skipped("row " + rowNumber + " has no description");
    }
    if (description.equalsIgnoreCase(PLACEHOLDER_DESCRIPTION)) {
      return RowOutcome.skipped("row " + rowNumber + " repeats the category header");
    }
    return RowOutcome.accepted(
        Risk.builder()
            .raisedBy(SlideTable.cell(row, 0))
            .description(description)
            .impact(SlideTable.cell(row, 2))
            .dateBecomesIssue(SlideTable.cell(row, 3))
            .status(SlideTable.cell(row, 4))
            .owner(SlideTable.cell(row, 5))
            .impactRating(SlideTable.cell(row, 6))
            .likelihood(SlideTable.cell(row, 7))
            .mitigation(SlideTable.cell(row, 8))
            .comments(SlideTable.cell(row, 9))
            .riskRating(SlideTable.cell(row, 10))
            .kind(kind)
            .build());
  }
}
