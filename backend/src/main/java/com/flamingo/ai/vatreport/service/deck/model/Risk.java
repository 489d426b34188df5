package com.flamingo.ai.vatreport.service.deck.model;

import lombok.Builder;

/**
 * One row of a risk or issue register. {@code description} is never blank.
 *
 * @param riskRating the RAG colour of the row's rating cell
 * @param kind register type, decided by the table header rather than per row
 */
@Builder
public record Risk(
    String raisedBy,
    String description,
    String impact,
    String dateBecomesIssue,
    String status,
    String owner,
    String impactRating,
    String likelihood,
    String mitigation,
    String comments,
    String riskRating,
    RiskKind kind) {}
