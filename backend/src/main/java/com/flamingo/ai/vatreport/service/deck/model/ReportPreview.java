package com.flamingo.ai.vatreport.service.deck.model;

import java.time.LocalDate;

/** Condensed view of a {@link ParsedReport} for confirming an upload before import. */
public record ReportPreview(
    String entityName,
    LocalDate reportDate,
    String overallStatus,
    String statusSummaryPreview,
    String openOppsStatus,
    String bigPlaysStatus,
    String accountGoalsStatus,
    String relationshipsStatus,
    String researchStatus,
    int risksCount,
    int plannerTasksCount,
    boolean hasOpenOpps,
    boolean hasBigPlays,
    boolean hasApproach,
    boolean hasOtherActivities) {

  public static ReportPreview of(ParsedReport report, int summaryLength) {
    String summary = report.statusSummary();
    return new ReportPreview(
        report.entityName(),
        report.reportDate(),
        report.overallStatus(),
        summary.length() > summaryLength ? summary.substring(0, summaryLength) : summary,
        report.openOppsStatus(),
        report.bigPlaysStatus(),
        report.accountGoalsStatus(),
        report.relationshipsStatus(),
        report.researchStatus(),
        report.risks().size(),
        report.plannerTasks().size(),
        !report.openOppsSummary().isEmpty(),
        !report.bigPlays().isEmpty(),
        !report.approachToShortfall().isEmpty(),
        !report.otherActivities().isEmpty());
  }
}
