package com.flamingo.ai.vatreport.service.deck.assemble;

import com.flamingo.ai.vatreport.service.deck.model.NarrativeSection;
import com.flamingo.ai.vatreport.service.deck.model.ParsedReport;
import com.flamingo.ai.vatreport.service.deck.model.PlannerTask;
import com.flamingo.ai.vatreport.service.deck.model.Risk;
import com.flamingo.ai.vatreport.service.deck.model.StatusCategory;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable report state for one entity group while its slides are merged. Scalars keep the first
 * non-empty value offered; narrative sections collect lines across slides.
 */
final class ReportDraft {

  private final String entityName;
  private LocalDate reportDate;
  private String overallStatus = "";
  private final Map<NarrativeSection, List<String>> narrative =
      new EnumMap<>(NarrativeSection.class);
  private final Map<StatusCategory, String> categoryStatuses =
      new EnumMap<>(StatusCategory.class);
  private final List<Risk> risks = new ArrayList<>();
  private final List<PlannerTask> plannerTasks = new ArrayList<>();

  ReportDraft(String entityName) {
    this.entityName = entityName;
  }

  boolean hasReportDate() {
    return reportDate != null;
  }

  void offerReportDate(LocalDate date) {
    if (reportDate == null && date != null) {
      reportDate = date;
    }
  }

  boolean hasOverallStatus() {
    return !overallStatus.isEmpty();
  }

  void offerOverallStatus(String status) {
    if (overallStatus.isEmpty() && status != null) {
      overallStatus = status;
    }
  }

  void offerCategoryStatus(StatusCategory category, String status) {
    if (status != null && !status.isEmpty()) {
      categoryStatuses.putIfAbsent(category, status);
    }
  }

  void appendNarrative(NarrativeSection section, String text) {
    if (text != null && !text.isEmpty()) {
      narrative.computeIfAbsent(section, s -> new ArrayList<>()).add(text);
    }
  }

  void addRisks(List<Risk> extracted) {
    risks.addAll(extracted);
  }

  void addPlannerTasks(List<PlannerTask> extracted) {
    plannerTasks.addAll(extracted);
  }

  ParsedReport build() {
    return ParsedReport.builder()
        .entityName(entityName)
        .reportDate(reportDate)
        .overallStatus(overallStatus)
        .statusSummary(narrative(NarrativeSection.STATUS_SUMMARY))
        .openOppsSummary(narrative(NarrativeSection.OPEN_OPPS))
        .bigPlays(narrative(NarrativeSection.BIG_PLAYS))
        .accountGoals(narrative(NarrativeSection.ACCOUNT_GOALS))
        .relationships(narrative(NarrativeSection.RELATIONSHIPS))
        .research(narrative(NarrativeSection.RESEARCH))
        .approachToShortfall(narrative(NarrativeSection.APPROACH))
        .otherActivities(narrative(NarrativeSection.OTHER))
        .openOppsStatus(categoryStatuses.getOrDefault(StatusCategory.OPEN_OPPS, ""))
        .bigPlaysStatus(categoryStatuses.getOrDefault(StatusCategory.BIG_PLAYS, ""))
        .accountGoalsStatus(categoryStatuses.getOrDefault(StatusCategory.ACCOUNT_GOALS, ""))
        .relationshipsStatus(categoryStatuses.getOrDefault(StatusCategory.RELATIONSHIPS, ""))
        .researchStatus(categoryStatuses.getOrDefault(StatusCategory.RESEARCH, ""))
        .risks(risks)
        .plannerTasks(plannerTasks)
        .build();
  }

  private String narrative(NarrativeSection section) {
    return String.join("\n", narrative.getOrDefault(section, List.of()));
  }
}
