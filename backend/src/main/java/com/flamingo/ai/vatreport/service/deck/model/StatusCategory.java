package com.flamingo.ai.vatreport.service.deck.model;

/** Narrative categories that also carry their own RAG status. */
public enum StatusCategory {
  OPEN_OPPS,
  BIG_PLAYS,
  ACCOUNT_GOALS,
  RELATIONSHIPS,
  RESEARCH
}
