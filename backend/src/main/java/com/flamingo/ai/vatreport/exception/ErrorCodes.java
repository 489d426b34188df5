package com.flamingo.ai.vatreport.exception;

/** Machine-readable codes carried by {@link ArchiveException}. */
public final class ErrorCodes {

  public static final String INVALID_ARCHIVE = "DECK_001";
  public static final String NO_SLIDES = "DECK_002";
  public static final String ZIP_SLIP = "DECK_003";
  public static final String EXTRACTION_FAILED = "DECK_004";

  private ErrorCodes() {}
}
