package org.calista.decipher.section.external;

/**
 * Rule-based correction of a generated translation.
 */
public interface PostProcessor {

    String postProcess(String text, String section);
}
