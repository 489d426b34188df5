package com.flamingo.ai.vatreport.config;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the slide deck extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "deck-parser")
@Getter
@Setter
public class DeckParserConfig {

  private Archive archive = new Archive();
  private Classification classification = new Classification();
  private Narrative narrative = new Narrative();

  /**
   * Ordered alias table used to resolve title slides to a canonical entity name. The first alias
   * that equals or is contained in the cleaned title wins, so order matters.
   */
  private List<EntityAlias> entityAliases = defaultAliases();

  @Getter
  @Setter
  public static class Archive {
    /** Prefix of the per-call temporary extraction directory. */
    private String tempDirPrefix = "pptx-";

    /** Parent directory for extraction; the JVM temp dir when blank. */
    private String tempBaseDir = "";
  }

  @Getter
  @Setter
  public static class Classification {
    /** Title slides are smaller than this many characters of markup. */
    private int titleSlideMaxMarkupSize = 3000;

    private int titleSlideMaxParagraphs = 2;

    /** Number of leading paragraphs scanned for dates and the fallback overall status. */
    private int headerScanDepth = 5;
  }

  @Getter
  @Setter
  public static class Narrative {
    /** A header colon must appear within this many characters for inline content to count. */
    private int headerColonWindow = 40;

    /** Length of the summary excerpt carried by a report preview. */
    private int previewSummaryLength = 200;
  }

  /** One alias spelling and the canonical entity name it maps to. */
  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class EntityAlias {
    private String alias;
    private String name;
  }

  private static List<EntityAlias> defaultAliases() {
    List<EntityAlias> aliases = new ArrayList<>();
    aliases.add(new EntityAlias("DAFF", "DAFF"));
    aliases.add(new EntityAlias("SAU", "SAU"));
    aliases.add(new EntityAlias("VICGOV", "VICGov"));
    aliases.add(new EntityAlias("VIC GOV", "VICGov"));
    aliases.add(new EntityAlias("DISR", "DISR"));
    aliases.add(new EntityAlias("GROWTH", "Growth"));
    aliases.add(new EntityAlias("P&P", "P&P"));
    aliases.add(new EntityAlias("PLATFORMS AND PARTNERSHIPS", "P&P"));
    aliases.add(new EntityAlias("EMERGING", "Emerging"));
    aliases.add(new EntityAlias("EMERGING ACCOUNTS", "Emerging"));
    return aliases;
  }
}
