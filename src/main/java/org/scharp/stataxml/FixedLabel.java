///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

/**
 * The texts of the value labels that are synthesized for columns with fixed codes.  A {@link SurveyMetadata}
 * translates these into the survey's language.
 */
public enum FixedLabel {
    /** The affirmative answer. */
    YES("Yes"),

    /** The negative answer. */
    NO("No"),

    /** The undecided answer of a Yes/No/Uncertain question. */
    UNCERTAIN("Uncertain"),

    /** The "F" answer of a gender question. */
    FEMALE("Female"),

    /** The "M" answer of a gender question. */
    MALE("Male"),

    /** The "I" answer of an Increase/Same/Decrease question. */
    INCREASE("Increase"),

    /** The "S" answer of an Increase/Same/Decrease question. */
    SAME("Same"),

    /** The "D" answer of an Increase/Same/Decrease question. */
    DECREASE("Decrease"),

    /** An option of a multiple choice question that was not checked. */
    NOT_SELECTED("Not Selected");

    private final String englishText;

    FixedLabel(String englishText) {
        this.englishText = englishText;
    }

    /**
     * Gets the English text of this label.
     *
     * @return This label in English. This is never {@code null}.
     */
    public String englishText() {
        return englishText;
    }
}
