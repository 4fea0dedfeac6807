package org.pagemark.progress;

/**
 * Section located from a global fraction.
 *
 * @param sectionIndex zero-based section index.
 * @param fractionInSection local fraction in {@code [0,1]}.
 */
public record SectionPosition(int sectionIndex, double fractionInSection) {
}
