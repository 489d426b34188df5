package com.flamingo.ai.vatreport.service.deck.model;

/**
 * Markup of one {@code ppt/slides/slideN.xml} entry as read from the archive.
 *
 * @param index the N of {@code slideN.xml}
 * @param xml UTF-8 decoded slide markup
 */
public record RawSlide(int index, String xml) {}
