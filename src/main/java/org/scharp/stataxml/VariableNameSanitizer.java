package org.scharp.stataxml;

/**
 * A function that rewrites a survey field code into a legal Stata variable name.
 */
@FunctionalInterface
public interface VariableNameSanitizer {

    /**
     * Rewrites a field code into a variable name.
     *
     * @param fieldCode
     *     The field code. This is never {@code null} or empty.
     *
     * @return A variable name. This must not be {@code null} or empty.
     */
    String sanitize(String fieldCode);
}
