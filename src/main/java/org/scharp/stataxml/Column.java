///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.Objects;

/**
 * A column of the exported dataset, which becomes one Stata variable.
 * <p>
 * Instances of this class are immutable.  They are created by normalizing a survey's {@link QuestionField}.
 * </p>
 */
public final class Column {

    private final String key;
    private final String name;
    private final String label;
    private final SemanticKind kind;
    private final int questionId;
    private final int scaleId;
    private final boolean nonNumericCodes;
    private final boolean otherOrComment;

    Column(String key, String name, String label, SemanticKind kind, int questionId, int scaleId,
        boolean nonNumericCodes, boolean otherOrComment) {
        this.key = key;
        this.name = name;
        this.label = label;
        this.kind = kind;
        this.questionId = questionId;
        this.scaleId = scaleId;
        this.nonNumericCodes = nonNumericCodes;
        this.otherOrComment = otherOrComment;
    }

    /**
     * Gets the key with which the column was selected.  This identifies the column throughout an export.
     *
     * @return The column's key. This is never {@code null}.
     */
    public String key() {
        return key;
    }

    /**
     * Gets the column's Stata variable name.
     *
     * @return The variable name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets the column's variable label.
     *
     * @return The variable label. This may be the empty string but never {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * @return The column's semantic kind. This is never {@code null}.
     */
    public SemanticKind kind() {
        return kind;
    }

    /**
     * @return The identity of the column's question.
     */
    public int questionId() {
        return questionId;
    }

    /**
     * @return The identity of the column's answer scale.
     */
    public int scaleId() {
        return scaleId;
    }

    /**
     * Gets whether any of the answer codes of the column's question is not an integer.  Such columns get the answer
     * text as their values instead of the code.
     *
     * @return {@code true}, if the question has a non-integer answer code.
     */
    public boolean hasNonNumericCodes() {
        return nonNumericCodes;
    }

    /**
     * Gets whether this column holds the free text of an "other" option or a comment.
     *
     * @return {@code true}, if this is an "other" or comment column.
     */
    public boolean isOtherOrComment() {
        return otherOrComment;
    }

    /**
     * Gets whether value labels may be attached to this column.  Stata only supports value labels on integers, so
     * this is {@code false} for columns whose codes are not integers and for "other" or comment columns.
     *
     * @return {@code true}, if this column may have a value label.
     */
    public boolean isLabelable() {
        return !nonNumericCodes && !otherOrComment;
    }

    /**
     * Gets whether this column's values are recoded into their answer texts.
     *
     * @return {@code true}, if the values of this column are replaced with answer texts.
     */
    boolean usesAnswerText() {
        return nonNumericCodes && !otherOrComment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, name, label, kind, questionId, scaleId, nonNumericCodes, otherOrComment);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column otherColumn)) {
            return false;
        }

        return key.equals(otherColumn.key) &&
            name.equals(otherColumn.name) &&
            label.equals(otherColumn.label) &&
            kind == otherColumn.kind &&
            questionId == otherColumn.questionId &&
            scaleId == otherColumn.scaleId &&
            nonNumericCodes == otherColumn.nonNumericCodes &&
            otherOrComment == otherColumn.otherOrComment;
    }

    @Override
    public String toString() {
        return name + " (" + key + ")";
    }
}
