package com.flamingo.ai.vatreport.service.deck.table;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.vatreport.service.deck.model.SlideTable;
import com.flamingo.ai.vatreport.service.deck.model.StatusCategory;
import com.flamingo.ai.vatreport.service.deck.model.StatusGrid;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StatusGridExtractor Tests")
class StatusGridExtractorTest {

  private final StatusGridExtractor extractor = new StatusGridExtractor();

  @Test
  @DisplayName("Should read the overall status from the header cell")
  void shouldReadOverallStatus() {
    StatusGrid grid =
        extractor.extract(
            SlideTable.of(
                List.of(
                    List.of("GREEN", "STATUS OVERALL", ""),
                    List.of("", "OPEN OPPS", ""),
                    List.of("", "BIG PLAYS", ""),
                    List.of("", "ACCOUNT GOALS", ""),
                    List.of("", "RESEARCH", ""))));

    assertThat(grid.overallStatus()).isEqualTo("GREEN");
  }

  @Test
  @DisplayName("Should leave the overall status empty when the header has no token")
  void shouldLeaveOverallStatusEmpty() {
    StatusGrid grid =
        extractor.extract(SlideTable.of(List.of(List.of("Reduced pipeline", "", ""))));

    assertThat(grid.overallStatus()).isEmpty();
  }

  @Test
  @DisplayName("Should assign category statuses from any of the three columns")
  void shouldAssignCategoryStatuses() {
    StatusGrid grid =
        extractor.extract(
            SlideTable.of(
                List.of(
                    List.of("Amber", "STATUS OVERALL", ""),
                    List.of("Two new deals", "Open Opps Actions", "Green"),
                    List.of("RED", "Big Plays", ""),
                    List.of("", "Account Goals", "n/a"),
                    List.of("", "Relationships", "amber"),
                    List.of("Nothing yet", "Research", ""))));

    assertThat(grid.overallStatus()).isEqualTo("AMBER");
    assertThat(grid.categoryStatus(StatusCategory.OPEN_OPPS)).isEqualTo("GREEN");
    assertThat(grid.categoryStatus(StatusCategory.BIG_PLAYS)).isEqualTo("RED");
    assertThat(grid.categoryStatus(StatusCategory.ACCOUNT_GOALS)).isEqualTo("N/A");
    assertThat(grid.categoryStatus(StatusCategory.RELATIONSHIPS)).isEqualTo("AMBER");
    assertThat(grid.categoryStatus(StatusCategory.RESEARCH)).isEmpty();
    assertThat(grid.summary()).isEmpty();
  }

  @Test
  @DisplayName("Should take the summary row and append unlabelled rows in order")
  void shouldBuildSummary() {
    StatusGrid grid =
        extractor.extract(
            SlideTable.of(
                List.of(
                    List.of("RED", "", ""),
                    List.of("Pipeline behind target", "Status Overall", ""),
                    List.of("Second summary row", "STATUS OVERALL", ""),
                    List.of("Hiring freeze", "", ""),
                    List.of("Overall Status RED", "", ""),
                    List.of("", "", ""),
                    List.of("Budget review", "", ""))));

    assertThat(grid.summary()).isEqualTo("Pipeline behind target\nHiring freeze\nBudget review");
  }
}
