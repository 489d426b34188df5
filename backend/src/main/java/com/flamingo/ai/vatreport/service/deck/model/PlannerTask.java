package com.flamingo.ai.vatreport.service.deck.model;

import lombok.Builder;

/**
 * One row of a planner task-bucket table. {@code taskName} is never blank.
 *
 * @param bucketName bucket of this row, inherited from the nearest earlier row when blank
 */
@Builder
public record PlannerTask(
    String bucketName,
    String taskName,
    String progress,
    String dueDate,
    String priority,
    String assignedTo,
    String labels) {}
