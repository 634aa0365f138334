///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.HashMap;
import java.util.Objects;

/**
 * The survey's description of one response column: which question it belongs to, the question's type, and the texts
 * from which the variable label is made.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link QuestionField.Builder}:
 * </p>
 *
 * <pre>
 * QuestionField field = QuestionField.builder().
 *     fieldCode("Q1_SQ001").
 *     questionId(12).
 *     questionType('F').
 *     questionText("How satisfied are you with...").
 *     subQuestion("the price").
 *     build();
 * </pre>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a
 * {@code HashMap}.
 * </p>
 */
public final class QuestionField {

    private final String fieldCode;
    private final int questionId;
    private final int scaleId;
    private final char questionType;
    private final String questionText;
    private final String subQuestion1;
    private final String subQuestion2;
    private final String subQuestion;
    private final String scale;
    private final boolean other;

    /**
     * A builder class for {@link QuestionField}.
     */
    public final static class Builder {
        private String fieldCode;
        private int questionId;
        private int scaleId;
        private char questionType;
        private String questionText;
        private String subQuestion1;
        private String subQuestion2;
        private String subQuestion;
        private String scale;
        private boolean other;

        private Builder() {
            this.fieldCode = null; // required parameter

            this.questionId = 0; // system fields don't belong to a question
            this.scaleId = 0;
            this.questionType = ' ';
            this.questionText = "";
            this.subQuestion1 = "";
            this.subQuestion2 = "";
            this.subQuestion = "";
            this.scale = "";
            this.other = false;
        }

        /**
         * Sets the field code, from which the Stata variable name is made.
         *
         * @param fieldCode
         *     The field's code, like "Q1_SQ001" or "submitdate".
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code fieldCode} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code fieldCode} is empty.
         */
        public Builder fieldCode(String fieldCode) {
            ArgumentUtil.checkNotNull(fieldCode, "fieldCode");
            if (fieldCode.isEmpty()) {
                throw new IllegalArgumentException("field codes cannot be blank");
            }

            this.fieldCode = fieldCode;
            return this;
        }

        /**
         * Sets the identity of the question to which the field belongs.
         *
         * @param questionId
         *     The question's identity.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code questionId} is negative.
         */
        public Builder questionId(int questionId) {
            ArgumentUtil.checkNotNegative(questionId, "questionId");

            this.questionId = questionId;
            return this;
        }

        /**
         * Sets the identity of the answer scale that the field uses.  Only dual-scale array questions use a scale other
         * than 0.
         *
         * @param scaleId
         *     The scale's identity.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code scaleId} is negative.
         */
        public Builder scaleId(int scaleId) {
            ArgumentUtil.checkNotNegative(scaleId, "scaleId");

            this.scaleId = scaleId;
            return this;
        }

        /**
         * Sets the single character type code of the question, like 'G' for a gender question.
         *
         * @param questionType
         *     The question's type code.
         *
         * @return This builder
         */
        public Builder questionType(char questionType) {
            this.questionType = questionType;
            return this;
        }

        /**
         * Sets the text of the question.
         *
         * @param questionText
         *     The question's text, which may contain markup.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code questionText} is {@code null}.
         */
        public Builder questionText(String questionText) {
            ArgumentUtil.checkNotNull(questionText, "questionText");

            this.questionText = questionText;
            return this;
        }

        /**
         * Sets the text of the first axis of a two-dimensional array question.
         *
         * @param subQuestion1
         *     The sub-question's text, or an empty string if there is none.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code subQuestion1} is {@code null}.
         */
        public Builder subQuestion1(String subQuestion1) {
            ArgumentUtil.checkNotNull(subQuestion1, "subQuestion1");

            this.subQuestion1 = subQuestion1;
            return this;
        }

        /**
         * Sets the text of the second axis of a two-dimensional array question.
         *
         * @param subQuestion2
         *     The sub-question's text, or an empty string if there is none.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code subQuestion2} is {@code null}.
         */
        public Builder subQuestion2(String subQuestion2) {
            ArgumentUtil.checkNotNull(subQuestion2, "subQuestion2");

            this.subQuestion2 = subQuestion2;
            return this;
        }

        /**
         * Sets the text of the sub-question.
         *
         * @param subQuestion
         *     The sub-question's text, or an empty string if there is none.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code subQuestion} is {@code null}.
         */
        public Builder subQuestion(String subQuestion) {
            ArgumentUtil.checkNotNull(subQuestion, "subQuestion");

            this.subQuestion = subQuestion;
            return this;
        }

        /**
         * Sets the header text of the field's answer scale.
         *
         * @param scale
         *     The scale's text, or an empty string if there is none.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code scale} is {@code null}.
         */
        public Builder scale(String scale) {
            ArgumentUtil.checkNotNull(scale, "scale");

            this.scale = scale;
            return this;
        }

        /**
         * Sets whether the field holds the free text of an "other" option.
         *
         * @param other
         *     {@code true}, if this is an "other" field.
         *
         * @return This builder
         */
        public Builder other(boolean other) {
            this.other = other;
            return this;
        }

        /**
         * Builds an immutable {@code QuestionField} with the configured options.
         *
         * @return a {@code QuestionField}
         *
         * @throws IllegalStateException
         *     if the field code hasn't been set.
         */
        public QuestionField build() {
            if (fieldCode == null) {
                throw new IllegalStateException("fieldCode must be set");
            }

            return new QuestionField(this);
        }
    }

    /**
     * Creates a new QuestionField builder for a field that belongs to no question, has no texts, and is not an "other"
     * field.
     * <p>
     * You must set the field code before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private QuestionField(Builder builder) {
        this.fieldCode = builder.fieldCode;
        this.questionId = builder.questionId;
        this.scaleId = builder.scaleId;
        this.questionType = builder.questionType;
        this.questionText = builder.questionText;
        this.subQuestion1 = builder.subQuestion1;
        this.subQuestion2 = builder.subQuestion2;
        this.subQuestion = builder.subQuestion;
        this.scale = builder.scale;
        this.other = builder.other;
    }

    /**
     * @return The field code. This is never {@code null}.
     */
    public String fieldCode() {
        return fieldCode;
    }

    /**
     * @return The identity of the field's question, or 0 for system fields.
     */
    public int questionId() {
        return questionId;
    }

    /**
     * @return The identity of the answer scale.
     */
    public int scaleId() {
        return scaleId;
    }

    /**
     * @return The question's single character type code.
     */
    public char questionType() {
        return questionType;
    }

    /**
     * @return The question's text. This may be the empty string but never {@code null}.
     */
    public String questionText() {
        return questionText;
    }

    /**
     * @return The text of the first array axis. This may be the empty string but never {@code null}.
     */
    public String subQuestion1() {
        return subQuestion1;
    }

    /**
     * @return The text of the second array axis. This may be the empty string but never {@code null}.
     */
    public String subQuestion2() {
        return subQuestion2;
    }

    /**
     * @return The sub-question's text. This may be the empty string but never {@code null}.
     */
    public String subQuestion() {
        return subQuestion;
    }

    /**
     * @return The scale's header text. This may be the empty string but never {@code null}.
     */
    public String scale() {
        return scale;
    }

    /**
     * @return {@code true}, if this field holds the text of an "other" option.
     */
    public boolean isOther() {
        return other;
    }

    /**
     * Gets a hash code for this field.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This field's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(fieldCode, questionId, scaleId, questionType, questionText, subQuestion1, subQuestion2,
            subQuestion, scale, other);
    }

    /**
     * Determines if this field is equal to another object.
     * <p>
     * Two fields are equal if and only if all of their properties are equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this field.
     *
     * @return {@code true}, if this field is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof QuestionField otherField)) {
            return false;
        }

        return fieldCode.equals(otherField.fieldCode) &&
            questionId == otherField.questionId &&
            scaleId == otherField.scaleId &&
            questionType == otherField.questionType &&
            questionText.equals(otherField.questionText) &&
            subQuestion1.equals(otherField.subQuestion1) &&
            subQuestion2.equals(otherField.subQuestion2) &&
            subQuestion.equals(otherField.subQuestion) &&
            scale.equals(otherField.scale) &&
            this.other == otherField.other;
    }
}
