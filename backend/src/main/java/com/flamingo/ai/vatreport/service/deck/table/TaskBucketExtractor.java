package com.flamingo.ai.vatreport.service.deck.table;

import com.flamingo.ai.vatreport.service.deck.model.PlannerTask;
import com.flamingo.ai.vatreport.service.deck.model.RowOutcome;
import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps the rows of a 7-column planner table onto {@link PlannerTask} records.
 *
 * <p>Columns: bucket, task name, progress, due date, priority, assigned to, labels. The bucket
 * column is only filled on the first row of each bucket, so a blank bucket cell takes the value of
 * the nearest non-blank one above it in the same table.
 */
@Component
@Slf4j
public class TaskBucketExtractor {

  public List<PlannerTask> extract(SlideTable table) {
    List<PlannerTask> tasks = new ArrayList<>();
    for (RowOutcome<PlannerTask> outcome : mapRows(table)) {
      if (outcome.isAccepted()) {
        tasks.add(outcome.value());
      } else {
        log.debug("Skipped planner row: {}", outcome.skipReason());
      }
    }
    return tasks;
  }

  /** Maps every body row, keeping the reason for each skipped one. */
  public List<RowOutcome<PlannerTask>> mapRows(SlideTable table) {
    if (table.rowCount() < 2) {
      return List.of();
    }
    List<RowOutcome<PlannerTask>> outcomes = new ArrayList<>();
    String currentBucket = "";
    int rowNumber = 0;
    for (List<String> row : table.bodyRows()) {
      rowNumber++;
      if (SlideTable.isBlankRow(row)) {
        outcomes.add(RowOutcome.skipped("row " + rowNumber + " is blank"));
        continue;
      }
      String bucket = SlideTable.cell(row, 0);
      if (!bucket.isEmpty()) {
        currentBucket = bucket;
      }
      String taskName = SlideTable.cell(row, 1);
      if (taskName.isEmpty()) {
        outcomes.add(RowOutcome.skipped("row " + rowNumber + " has no task name"));
        continue;
      }
      outcomes.add(
          RowOutcome.accepted(
              PlannerTask.builder()
                  .bucketName(currentBucket)
                  .taskName(taskName)
                  .progress(SlideTable.cell(row, 2))
                  .dueDate(SlideTable.cell(row, 3))
                  .priority(SlideTable.cell(row, 4))
                  .assignedTo(SlideTable.cell(row, 5))
                  .labels(SlideTable.cell(row, 6))
                  .build()));
    }
    return outcomes;
  }
}
