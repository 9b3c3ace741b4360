package org.calista.decipher.section.external;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the raw transcription tokens of a section.
 */
public interface TranscriptionSource {

    /**
     * @return tokens in manuscript order (never null, may be empty)
     * @throws java.util.NoSuchElementException if the section is unknown
     */
    List<String> loadSectionTokens(String section) throws IOException;
}
