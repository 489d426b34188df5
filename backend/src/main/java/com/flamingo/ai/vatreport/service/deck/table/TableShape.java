package com.flamingo.ai.vatreport.service.deck.table;

/** Recognised table layouts. */
public enum TableShape {
  /** 3 columns, at least 5 rows: overall status, summary and per-category RAG statuses. */
  STATUS_GRID,
  /** 11 columns with a "raised by" header: risk or issue register. */
  RISK_REGISTER,
  /** 7 columns with a "bucket" header: planner tasks. */
  TASK_BUCKET,
  UNRECOGNISED
}
