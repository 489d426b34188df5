package com.flamingo.ai.vatreport.service.deck.model;

/** Whether a register row came from a risk register or an issue register. */
public enum RiskKind {
  RISK("risk"),
  ISSUE("issue");

  private final String value;

  RiskKind(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
