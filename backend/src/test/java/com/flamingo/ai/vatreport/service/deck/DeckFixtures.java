package com.flamingo.ai.vatreport.service.deck;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.service.deck.archive.SlideArchiveReader;
import com.flamingo.ai.vatreport.service.deck.assemble.ReportAssembler;
import com.flamingo.ai.vatreport.service.deck.assemble.ReportDateExtractor;
import com.flamingo.ai.vatreport.service.deck.classify.EntityNameResolver;
import com.flamingo.ai.vatreport.service.deck.classify.SlideClassifier;
import com.flamingo.ai.vatreport.service.deck.extract.SlideXmlExtractor;
import com.flamingo.ai.vatreport.service.deck.group.EntityGrouper;
import com.flamingo.ai.vatreport.service.deck.narrative.NarrativeSectionClassifier;
import com.flamingo.ai.vatreport.service.deck.table.RiskRegisterExtractor;
import com.flamingo.ai.vatreport.service.deck.table.StatusGridExtractor;
import com.flamingo.ai.vatreport.service.deck.table.TableClassifier;
import com.flamingo.ai.vatreport.service.deck.table.TaskBucketExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Builds slide markup, PPTX archives and a fully wired parser for tests. */
public final class DeckFixtures {

  private static final String SLIDE_OPEN =
      "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
          + "<p:sld xmlns:a=\"http://schemas.openxmlformats.org/drawingml/2006/main\""
          + " xmlns:p=\"http://schemas.openxmlformats.org/presentationml/2006/main\">"
          + "<p:cSld><p:spTree>";
  private static final String SLIDE_CLOSE = "</p:spTree></p:cSld></p:sld>";

  private DeckFixtures() {}

  /** Slide markup with the given paragraphs in one text box, followed by the given tables. */
  @SafeVarargs
  public static String slideXml(List<String> paragraphs, List<List<String>>... tables) {
    StringBuilder xml = new StringBuilder(SLIDE_OPEN);
    if (!paragraphs.isEmpty()) {
      xml.append("<p:sp><p:txBody>");
      paragraphs.forEach(p -> xml.append(paragraph(p)));
      xml.append("</p:txBody></p:sp>");
    }
    for (List<List<String>> table : tables) {
      xml.append("<p:graphicFrame><a:graphic><a:graphicData>").append(table(table));
      xml.append("</a:graphicData></a:graphic></p:graphicFrame>");
    }
    return xml.append(SLIDE_CLOSE).toString();
  }

  public static String paragraph(String text) {
    return "<a:p><a:pPr algn=\"l\"/><a:r><a:rPr lang=\"en-AU\"/><a:t>"
        + escape(text)
        + "</a:t></a:r></a:p>";
  }

  public static String table(List<List<String>> rows) {
    StringBuilder xml = new StringBuilder("<a:tbl><a:tblGrid/>");
    for (List<String> row : rows) {
      xml.append("<a:tr h=\"370840\">");
      for (String cell : row) {
        xml.append("<a:tc><a:txBody>");
        xml.append(cell.isEmpty() ? "<a:p><a:endParaRPr lang=\"en-AU\"/></a:p>" : paragraph(cell));
        xml.append("</a:txBody></a:tc>");
      }
      xml.append("</a:tr>");
    }
    return xml.append("</a:tbl>").toString();
  }

  /** Zip with one {@code ppt/slides/slideN.xml} per entry, keyed by N, written in map order. */
  public static byte[] deck(Map<Integer, String> slidesByNumber) {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("[Content_Types].xml", "<Types/>");
    slidesByNumber.forEach((n, xml) -> entries.put("ppt/slides/slide" + n + ".xml", xml));
    return zip(entries);
  }

  /** Deck whose slides are numbered 1..n in list order. */
  public static byte[] deck(List<String> slides) {
    Map<Integer, String> numbered = new LinkedHashMap<>();
    for (int i = 0; i < slides.size(); i++) {
      numbered.put(i + 1, slides.get(i));
    }
    return deck(numbered);
  }

  public static byte[] zip(Map<String, String> entries) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out)) {
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        zip.putNextEntry(new ZipEntry(entry.getKey()));
        zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  public static DeckParsingServiceImpl parser(
      DeckParserConfig config, Clock clock, MeterRegistry meterRegistry) {
    EntityNameResolver resolver = new EntityNameResolver(config);
    TableClassifier tableClassifier = new TableClassifier();
    TaskBucketExtractor taskBucketExtractor = new TaskBucketExtractor();
    ReportDateExtractor dateExtractor = new ReportDateExtractor(config);
    ReportAssembler assembler =
        new ReportAssembler(
            tableClassifier,
            new StatusGridExtractor(),
            new RiskRegisterExtractor(),
            taskBucketExtractor,
            new NarrativeSectionClassifier(config),
            dateExtractor,
            config,
            clock);
    return new DeckParsingServiceImpl(
        new SlideArchiveReader(config),
        new SlideXmlExtractor(),
        new SlideClassifier(config, resolver),
        new EntityGrouper(),
        assembler,
        dateExtractor,
        config,
        meterRegistry);
  }

  private static String escape(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
