package org.calista.decipher.section;

/**
 * A section could not be processed. The section produces no result at all.
 */
public class SectionFailedException extends Exception {

    private final String section;

    public SectionFailedException(String section, Throwable cause) {
        super("section '" + section + "' failed: " + describe(cause), cause);
        this.section = section;
    }

    public String section() {
        return section;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        String m = t.getMessage();
        return t.getClass().getSimpleName() + ((m == null || m.isBlank()) ? "" : (": " + m));
    }
}
