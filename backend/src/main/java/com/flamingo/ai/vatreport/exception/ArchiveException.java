package com.flamingo.ai.vatreport.exception;

/**
 * Thrown when a slide deck cannot be opened: the bytes are not an archive, the archive holds no
 * slides, or an entry would be extracted outside the extraction directory.
 *
 * <p>This is the only failure that aborts a parse. Everything else is resolved by defaulting.
 */
public class ArchiveException extends RuntimeException {

  private final String code;
  private final String userMessage;

  public ArchiveException(String code, String message) {
    super(message);
    this.code = code;
    this.userMessage = defaultUserMessage(code);
  }

  public ArchiveException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.userMessage = defaultUserMessage(code);
  }

  public String getCode() {
    return code;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String defaultUserMessage(String code) {
    return switch (code) {
      case ErrorCodes.NO_SLIDES -> "No slides found in the PPTX file.";
      case ErrorCodes.ZIP_SLIP -> "The PPTX file contains an unsafe entry path.";
      default -> "Failed to extract PPTX file. Make sure it's a valid PowerPoint file.";
    };
  }
}
