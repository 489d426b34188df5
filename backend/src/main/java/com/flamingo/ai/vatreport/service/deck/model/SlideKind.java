package com.flamingo.ai.vatreport.service.deck.model;

/** Role of a slide within the deck. */
public enum SlideKind {
  /** The deck's own cover page; never part of an entity. */
  DECK_COVER,
  /** No paragraphs and no tables. */
  EMPTY,
  /** Opens a new entity group. */
  TITLE,
  /** Task-tracking slide belonging to the open entity. */
  STATUS_UPDATE,
  CONTENT
}
