package com.flamingo.ai.vatreport.service.deck.group;

import com.flamingo.ai.vatreport.service.deck.model.ClassifiedSlide;
import com.flamingo.ai.vatreport.service.deck.model.EntityGroup;
import com.flamingo.ai.vatreport.service.deck.model.GroupingResult;
import com.flamingo.ai.vatreport.service.deck.model.SlideContent;
import com.flamingo.ai.vatreport.service.deck.model.SlideKind;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits classified slides into entity groups. A title slide opens a group; the slides that follow
 * belong to it until the next title slide. Slides seen before any title slide are dropped and
 * reported as warnings.
 */
@Component
@Slf4j
public class EntityGrouper {

  public GroupingResult group(List<ClassifiedSlide> slides) {
    Accumulator acc = new Accumulator();
    for (ClassifiedSlide classified : slides) {
      acc.accept(classified);
    }
    return acc.finish();
  }

  /** Scan state for a single grouping pass. */
  private static final class Accumulator {

    private final List<EntityGroup> groups = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private OpenGroup open;

    void accept(ClassifiedSlide classified) {
      SlideContent slide = classified.slide();
      switch (classified.kind()) {
        case DECK_COVER, EMPTY -> {
          // not part of any entity
        }
        case TITLE -> {
          close();
          open = new OpenGroup(classified.entityName(), slide);
        }
        case STATUS_UPDATE, CONTENT -> {
          if (open == null) {
            String warning =
                "slide " + slide.index() + " dropped: no entity title slide precedes it";
            log.debug(warning);
            warnings.add(warning);
          } else if (classified.kind() == SlideKind.STATUS_UPDATE) {
            open.statusUpdateSlides.add(slide);
          } else {
            open.contentSlides.add(slide);
          }
        }
      }
    }

    GroupingResult finish() {
      close();
      return new GroupingResult(groups, warnings);
    }

    private void close() {
      if (open != null) {
        groups.add(
            new EntityGroup(
                open.entityName, open.titleSlide, open.contentSlides, open.statusUpdateSlides));
        open = null;
      }
    }
  }

  private static final class OpenGroup {

    private final String entityName;
    private final SlideContent titleSlide;
    private final List<SlideContent> contentSlides = new ArrayList<>();
    private final List<SlideContent> statusUpdateSlides = new ArrayList<>();

    OpenGroup(String entityName, SlideContent titleSlide) {
      this.entityName = entityName;
      this.titleSlide = titleSlide;
    }
  }
}
