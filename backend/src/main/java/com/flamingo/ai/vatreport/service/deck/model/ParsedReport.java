package com.flamingo.ai.vatreport.service.deck.model;

import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/**
 * The extracted report for one entity. Every text field is an empty string when nothing was
 * found; narrative fields hold newline-separated lines.
 */
@Builder
public record ParsedReport(
    String entityName,
    LocalDate reportDate,
    String overallStatus,
    String statusSummary,
    String openOppsSummary,
    String bigPlays,
    String accountGoals,
    String relationships,
    String research,
    String approachToShortfall,
    String otherActivities,
    String openOppsStatus,
    String bigPlaysStatus,
    String accountGoalsStatus,
    String relationshipsStatus,
    String researchStatus,
    List<Risk> risks,
    List<PlannerTask> plannerTasks) {

  public ParsedReport {
    risks = risks == null ? List.of() : List.copyOf(risks);
    plannerTasks = plannerTasks == null ? List.of() : List.copyOf(plannerTasks);
  }

  /** One-line description used in the parse summary. */
  public String summaryLine() {
    String status = overallStatus == null || overallStatus.isEmpty() ? "not set" : overallStatus;
    return entityName
        + ": "
        + risks.size()
        + " risks, "
        + plannerTasks.size()
        + " planner tasks, status: "
        + status;
  }
}
