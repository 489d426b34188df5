package com.flamingo.ai.vatreport.service.deck.classify;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.config.DeckParserConfig.EntityAlias;
import com.flamingo.ai.vatreport.service.deck.extract.XmlText;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Maps title-slide text such as {@code "DAFF VAT"} onto a canonical entity name. */
@Component
@RequiredArgsConstructor
public class EntityNameResolver {

  private static final Pattern VAT_WORD = Pattern.compile("\\s*VAT\\s*", Pattern.CASE_INSENSITIVE);

  private final DeckParserConfig config;

  /**
   * Resolves a title to an entity name. The literal {@code VAT} is removed, the rest is
   * upper-cased and compared against each alias in order; the first alias that equals the text or
   * occurs within it wins.
   *
   * @param rawTitle title text, entities may still be encoded
   * @return canonical entity name, or empty when no alias matches
   */
  public Optional<String> resolve(String rawTitle) {
    if (rawTitle == null) {
      return Optional.empty();
    }
    String cleaned =
        VAT_WORD.matcher(XmlText.decode(rawTitle)).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
    if (cleaned.isEmpty()) {
      return Optional.empty();
    }
    for (EntityAlias alias : config.getEntityAliases()) {
      String key = alias.getAlias().toUpperCase(Locale.ROOT);
      if (cleaned.equals(key) || cleaned.contains(key)) {
        return Optional.of(alias.getName());
      }
    }
    return Optional.empty();
  }
}
