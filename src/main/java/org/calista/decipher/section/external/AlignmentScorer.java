package org.calista.decipher.section.external;

/**
 * Text/illustration agreement score of a section (higher is better).
 */
public interface AlignmentScorer {

    double alignmentScore(String section);
}
