package org.pagemark.progress;

import lombok.Builder;
import lombok.Value;

/**
 * Reader-facing progress snapshot for one position.
 */
@Value
@Builder
public class ReadingProgress {
    /**
     * Global fraction in {@code [0,1]} at the end of the visible page.
     */
    double fraction;

    int sectionCurrent;
    int sectionTotal;

    /**
     * Location at the start of the visible page.
     */
    long locationCurrent;

    /**
     * Location at the end of the visible page.
     */
    long locationNext;

    long locationTotal;

    /**
     * Estimated minutes left in the current section.
     */
    double minutesLeftInSection;

    /**
     * Estimated minutes left in the document.
     */
    double minutesLeftInBook;
}
