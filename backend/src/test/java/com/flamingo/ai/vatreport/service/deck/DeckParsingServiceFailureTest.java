package com.flamingo.ai.vatreport.service.deck;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.vatreport.config.DeckParserConfig;
import com.flamingo.ai.vatreport.exception.ArchiveException;
import com.flamingo.ai.vatreport.exception.ErrorCodes;
import com.flamingo.ai.vatreport.service.deck.archive.SlideArchiveReader;
import com.flamingo.ai.vatreport.service.deck.assemble.ReportAssembler;
import com.flamingo.ai.vatreport.service.deck.assemble.ReportDateExtractor;
import com.flamingo.ai.vatreport.service.deck.classify.SlideClassifier;
import com.flamingo.ai.vatreport.service.deck.extract.SlideXmlExtractor;
import com.flamingo.ai.vatreport.service.deck.group.EntityGrouper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeckParsingServiceImpl failure handling Tests")
class DeckParsingServiceFailureTest {

  @Mock private SlideArchiveReader archiveReader;
  @Mock private SlideXmlExtractor slideXmlExtractor;
  @Mock private SlideClassifier slideClassifier;
  @Mock private EntityGrouper entityGrouper;
  @Mock private ReportAssembler reportAssembler;
  @Mock private ReportDateExtractor reportDateExtractor;

  private MeterRegistry meterRegistry;
  private DeckParsingServiceImpl service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DeckParsingServiceImpl(
            archiveReader,
            slideXmlExtractor,
            slideClassifier,
            entityGrouper,
            reportAssembler,
            reportDateExtractor,
            new DeckParserConfig(),
            meterRegistry);
  }

  @Test
  @DisplayName("Should rethrow archive failures without running later stages")
  void shouldStopAtArchiveFailure() {
    when(archiveReader.readSlides(any()))
        .thenThrow(
            new ArchiveException(
                ErrorCodes.ZIP_SLIP,
                "Zip Slip detected: entry '../evil' resolves outside extraction directory"));

    assertThatThrownBy(() -> service.parse(new byte[] {1, 2, 3}))
        .isInstanceOf(ArchiveException.class)
        .hasMessageContaining("Zip Slip");

    verifyNoInteractions(slideXmlExtractor, slideClassifier, entityGrouper, reportAssembler);
    assertThat(meterRegistry.counter("deck.parse.failure", "error_code", ErrorCodes.ZIP_SLIP)
            .count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("deck.parse.success").count()).isZero();
  }

  @Test
  @DisplayName("Should tag failures with their own error code")
  void shouldTagFailuresByCode() {
    when(archiveReader.readSlides(any()))
        .thenThrow(new ArchiveException(ErrorCodes.EXTRACTION_FAILED, "disk full"));

    assertThatThrownBy(() -> service.preview(new byte[] {1}))
        .isInstanceOf(ArchiveException.class);

    assertThat(
            meterRegistry
                .counter("deck.parse.failure", "error_code", ErrorCodes.EXTRACTION_FAILED)
                .count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("deck.parse.failure", "error_code", ErrorCodes.ZIP_SLIP)
            .count())
        .isZero();
  }
}
