package com.flamingo.ai.vatreport.service.deck.extract;

/** Decoding applied to every piece of text read from slide markup. */
public final class XmlText {

  private XmlText() {}

  /**
   * Decodes the five predefined XML entities and normalises typographic dashes. The non-breaking
   * hyphen (U+2011) becomes a plain hyphen; en (U+2013) and em (U+2014) dashes pass through
   * unchanged.
   *
   * @param raw text as it appears in the markup, may be null
   * @return decoded text, empty for null input
   */
  public static String decode(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    return raw.replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&apos;", "'")
        .replace("&quot;", "\"")
        // &amp; last: "&amp;lt;" decodes to the literal text "&lt;"
        .replace("&amp;", "&")
        .replace('\u2011', '-');
  }
}
