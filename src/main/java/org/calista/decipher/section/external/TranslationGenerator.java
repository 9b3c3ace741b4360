package org.calista.decipher.section.external;

/**
 * Produces a draft translation for a section. Output is raw; see {@link PostProcessor}.
 */
public interface TranslationGenerator {

    String generateTranslation(String section);
}
