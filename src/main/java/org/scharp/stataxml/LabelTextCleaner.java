package org.scharp.stataxml;

/**
 * A function that flattens the survey's (possibly HTML) texts into plain text for use in labels.
 */
@FunctionalInterface
public interface LabelTextCleaner {

    /**
     * Flattens a text.
     *
     * @param text
     *     The text to clean. This is never {@code null}.
     *
     * @return The plain text. This must not be {@code null}.
     */
    String clean(String text);
}
