package com.flamingo.ai.vatreport.service.deck.model;

/** The eight free-text sections of a report. */
public enum NarrativeSection {
  STATUS_SUMMARY,
  OPEN_OPPS,
  BIG_PLAYS,
  ACCOUNT_GOALS,
  RELATIONSHIPS,
  RESEARCH,
  APPROACH,
  OTHER
}
