package com.flamingo.ai.vatreport.service.deck.archive;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.exception.ArchiveException;
import com.flamingo.ai.vatreport.exception.ErrorCodes;
import com.flamingo.ai.vatreport.service.deck.model.RawSlide;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Extracts the slide XML entries of a PPTX package.
 *
 * <p>Each call works in its own freshly created temporary directory, which is removed before the
 * call returns or throws. Every archive entry is checked against that directory before anything
 * is written, so an entry such as {@code ../../etc/passwd} aborts the whole read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlideArchiveReader {

  private static final Pattern SLIDE_ENTRY = Pattern.compile("^ppt/slides/slide(\\d{1,9})\\.xml$");

  private final DeckParserConfig config;

  /**
   * Reads all {@code ppt/slides/slideN.xml} entries, ordered by N.
   *
   * @param deck raw PPTX bytes
   * @return slide markup in numeric slide order
   * @throws ArchiveException if the bytes are not an archive, hold no slides, or contain an entry
   *     that resolves outside the extraction directory
   */
  public List<RawSlide> readSlides(byte[] deck) {
    if (deck == null || deck.length == 0) {
      throw new ArchiveException(ErrorCodes.INVALID_ARCHIVE, "Empty PPTX payload");
    }

    Path extractionRoot = createExtractionRoot();
    try {
      Map<Integer, Path> slideFiles = extract(deck, extractionRoot);
      List<RawSlide> slides = new ArrayList<>(slideFiles.size());
      for (Map.Entry<Integer, Path> entry : slideFiles.entrySet()) {
        String xml = Files.readString(entry.getValue(), StandardCharsets.UTF_8);
        slides.add(new RawSlide(entry.getKey(), xml));
      }
      log.debug("Read {} slide entries from deck of {} bytes", slides.size(), deck.length);
      return slides;
    } catch (IOException e) {
      throw new ArchiveException(
          ErrorCodes.EXTRACTION_FAILED, "Failed to read extracted slides: " + e.getMessage(), e);
    } finally {
      cleanup(extractionRoot);
    }
  }

  private Map<Integer, Path> extract(byte[] deck, Path extractionRoot) {
    Path canonicalRoot = canonical(extractionRoot);
    Map<Integer, Path> slideFiles = new TreeMap<>();
    int entryCount = 0;

    try (ZipInputStream zipIn = new ZipInputStream(new ByteArrayInputStream(deck))) {
      ZipEntry entry;
      while ((entry = zipIn.getNextEntry()) != null) {
        entryCount++;
        String name = entry.getName();
        Path target = resolveEntry(canonicalRoot, name);
        if (!target.startsWith(canonicalRoot)) {
          throw new ArchiveException(
              ErrorCodes.ZIP_SLIP,
              "Zip Slip detected: entry '" + name + "' resolves outside extraction directory");
        }

        Matcher matcher = SLIDE_ENTRY.matcher(name);
        if (!entry.isDirectory() && matcher.matches()) {
          Files.createDirectories(target.getParent());
          Files.copy(zipIn, target, StandardCopyOption.REPLACE_EXISTING);
          slideFiles.put(Integer.parseInt(matcher.group(1)), target);
        }
        zipIn.closeEntry();
      }
    } catch (ZipException e) {
      throw new ArchiveException(
          ErrorCodes.INVALID_ARCHIVE, "Not a valid PPTX archive: " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      // entry name not decodable as UTF-8
      throw new ArchiveException(
          ErrorCodes.INVALID_ARCHIVE,
          "Unreadable entry name in PPTX archive: " + e.getMessage(),
          e);
    } catch (IOException e) {
      throw new ArchiveException(
          ErrorCodes.EXTRACTION_FAILED, "Failed to extract PPTX file: " + e.getMessage(), e);
    }

    if (entryCount == 0) {
      throw new ArchiveException(ErrorCodes.INVALID_ARCHIVE, "Not a valid PPTX archive");
    }
    if (slideFiles.isEmpty()) {
      throw new ArchiveException(ErrorCodes.NO_SLIDES, "No slides found in the PPTX file");
    }
    return slideFiles;
  }

  private Path createExtractionRoot() {
    String prefix = config.getArchive().getTempDirPrefix();
    String baseDir = config.getArchive().getTempBaseDir();
    try {
      if (baseDir == null || baseDir.isBlank()) {
        return Files.createTempDirectory(prefix);
      }
      return Files.createTempDirectory(Path.of(baseDir), prefix);
    } catch (IOException e) {
      throw new ArchiveException(
          ErrorCodes.EXTRACTION_FAILED, "Could not create extraction directory", e);
    }
  }

  private static Path resolveEntry(Path canonicalRoot, String name) {
    try {
      return canonical(canonicalRoot.resolve(name));
    } catch (InvalidPathException e) {
      throw new ArchiveException(
          ErrorCodes.INVALID_ARCHIVE, "Invalid entry name '" + name + "' in PPTX archive", e);
    }
  }

  private static Path canonical(Path path) {
    try {
      return path.toFile().getCanonicalFile().toPath();
    } catch (IOException e) {
      throw new ArchiveException(
          ErrorCodes.EXTRACTION_FAILED, "Cannot resolve extraction path " + path, e);
    }
  }

  private void cleanup(Path extractionRoot) {
    try {
      FileSystemUtils.deleteRecursively(extractionRoot);
    } catch (IOException e) {
      log.warn("Failed to remove extraction directory {}: {}", extractionRoot, e.getMessage());
    }
  }
}
