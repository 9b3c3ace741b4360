package org.calista.decipher.core;

/**
 * Raised when search, graph or run parameters are unusable.
 * Always thrown before any search or graph work starts; never retried.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static void check(boolean condition, String message) {
        if (!condition) throw new InvalidConfigurationException(message);
    }

    public static double probability(double p, String name) {
        if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
            throw new InvalidConfigurationException(name + " must be within [0,1]: " + p);
        }
        return p;
    }
}
