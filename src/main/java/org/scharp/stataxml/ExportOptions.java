///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Properties;

/**
 * The settings of an export.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link ExportOptions.Builder}:
 * </p>
 *
 * <pre>
 * ExportOptions options = ExportOptions.builder().
 *     decimalSeparator(DecimalSeparator.COMMA).
 *     yesCode(1).
 *     noCode(2).
 *     build();
 * </pre>
 *
 * <p>
 * They can also be read from a {@link Properties} object with {@link #fromProperties(Properties)}.
 * </p>
 */
public final class ExportOptions {

    /** The property that holds the decimal separator ("POINT" or "COMMA"). */
    public static final String DECIMAL_SEPARATOR_PROPERTY = "stataxml.decimalSeparator";

    /** The property that holds the code for "Yes". */
    public static final String YES_CODE_PROPERTY = "stataxml.yesCode";

    /** The property that holds the code for "No". */
    public static final String NO_CODE_PROPERTY = "stataxml.noCode";

    /** The property that holds the prefix of value label names. */
    public static final String LABEL_SET_PREFIX_PROPERTY = "stataxml.labelSetPrefix";

    /** The fixed code of an unselected multiple choice option. */
    static final int NOT_SELECTED_CODE = 0;

    /** The fixed code of an "Uncertain" answer. */
    static final int UNCERTAIN_CODE = 9;

    private final DecimalSeparator decimalSeparator;
    private final int yesCode;
    private final int noCode;
    private final String labelSetPrefix;
    private final LocalDateTime creationTime;
    private final VariableNameSanitizer variableNameSanitizer;
    private final LabelTextCleaner labelTextCleaner;

    /**
     * A builder class for {@link ExportOptions}.
     */
    public final static class Builder {
        private DecimalSeparator decimalSeparator;
        private int yesCode;
        private int noCode;
        private String labelSetPrefix;
        private LocalDateTime creationTime;
        private VariableNameSanitizer variableNameSanitizer;
        private LabelTextCleaner labelTextCleaner;

        private Builder() {
            this.decimalSeparator = DecimalSeparator.POINT;
            this.yesCode = 1;
            this.noCode = 0;
            this.labelSetPrefix = "vall";
            this.creationTime = LocalDateTime.now();
            this.variableNameSanitizer = new StataVariableNameSanitizer();
            this.labelTextCleaner = new MarkupStrippingCleaner();
        }

        /**
         * Sets the decimal separator that respondents use.
         *
         * @param decimalSeparator
         *     The decimal separator.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code decimalSeparator} is {@code null}.
         */
        public Builder decimalSeparator(DecimalSeparator decimalSeparator) {
            ArgumentUtil.checkNotNull(decimalSeparator, "decimalSeparator");

            this.decimalSeparator = decimalSeparator;
            return this;
        }

        /**
         * Sets the code to which "Y" answers of Yes/No and multiple choice questions are recoded.
         *
         * @param yesCode
         *     The code for "Yes".
         *
         * @return This builder
         */
        public Builder yesCode(int yesCode) {
            this.yesCode = yesCode;
            return this;
        }

        /**
         * Sets the code to which "N" answers of Yes/No questions are recoded.
         *
         * @param noCode
         *     The code for "No".
         *
         * @return This builder
         */
        public Builder noCode(int noCode) {
            this.noCode = noCode;
            return this;
        }

        /**
         * Sets the prefix of value label names.  A value label is named by its prefix, its question's identity and
         * its scale's identity.
         *
         * @param labelSetPrefix
         *     The new prefix.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code labelSetPrefix} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code labelSetPrefix} doesn't start with a letter, contains anything other than ASCII letters, digits,
         *     and underscores, or is longer than 16 bytes.
         */
        public Builder labelSetPrefix(String labelSetPrefix) {
            ArgumentUtil.checkNotNull(labelSetPrefix, "labelSetPrefix");
            if (!labelSetPrefix.matches("^[A-Za-z][A-Za-z0-9_]*$")) {
                throw new IllegalArgumentException(
                    "labelSetPrefix must start with a letter and contain only letters, digits, and underscores");
            }
            ArgumentUtil.checkMaximumLength(labelSetPrefix, StandardCharsets.US_ASCII, 16, "labelSetPrefix");

            this.labelSetPrefix = labelSetPrefix;
            return this;
        }

        /**
         * Sets the time which is written as the dataset's time stamp.
         *
         * @param creationTime
         *     The dataset's creation time.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code creationTime} is {@code null}.
         */
        public Builder creationTime(LocalDateTime creationTime) {
            ArgumentUtil.checkNotNull(creationTime, "creationTime");

            this.creationTime = creationTime;
            return this;
        }

        /**
         * Sets the function that turns field codes into legal Stata variable names.
         *
         * @param variableNameSanitizer
         *     The sanitizer.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code variableNameSanitizer} is {@code null}.
         */
        public Builder variableNameSanitizer(VariableNameSanitizer variableNameSanitizer) {
            ArgumentUtil.checkNotNull(variableNameSanitizer, "variableNameSanitizer");

            this.variableNameSanitizer = variableNameSanitizer;
            return this;
        }

        /**
         * Sets the function that removes markup from the survey's texts.
         *
         * @param labelTextCleaner
         *     The cleaner.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code labelTextCleaner} is {@code null}.
         */
        public Builder labelTextCleaner(LabelTextCleaner labelTextCleaner) {
            ArgumentUtil.checkNotNull(labelTextCleaner, "labelTextCleaner");

            this.labelTextCleaner = labelTextCleaner;
            return this;
        }

        /**
         * Builds the immutable {@code ExportOptions} with the configured options.
         *
         * @return An {@code ExportOptions}
         *
         * @throws IllegalStateException
         *     if the codes for "Yes" and "No" are the same, if the code for "Yes" is 0 (the code for "Not Selected"),
         *     or if either code is 9 (the code for "Uncertain").
         */
        public ExportOptions build() {
            if (yesCode == noCode) {
                throw new IllegalStateException("yesCode and noCode must be different");
            }
            if (yesCode == NOT_SELECTED_CODE) {
                throw new IllegalStateException(
                    "yesCode must not be " + NOT_SELECTED_CODE + ", the code for \"Not Selected\"");
            }
            if (yesCode == UNCERTAIN_CODE || noCode == UNCERTAIN_CODE) {
                String name = yesCode == UNCERTAIN_CODE ? "yesCode" : "noCode";
                throw new IllegalStateException(
                    name + " must not be " + UNCERTAIN_CODE + ", the code for \"Uncertain\"");
            }
            return new ExportOptions(this);
        }
    }

    /**
     * Creates a new builder initialized with a point as the decimal separator, 1 for "Yes", 0 for "No", "vall" as the
     * label set prefix, the current time as the creation time, and the default name sanitizer and text cleaner.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from properties.  Properties that are not given keep their default values.
     *
     * @param properties
     *     The properties to read.
     *
     * @return The options.
     *
     * @throws NullPointerException
     *     if {@code properties} is {@code null}.
     * @throws IllegalArgumentException
     *     if a property has an illegal value.
     */
    public static ExportOptions fromProperties(Properties properties) {
        ArgumentUtil.checkNotNull(properties, "properties");

        Builder builder = builder();

        String decimalSeparator = properties.getProperty(DECIMAL_SEPARATOR_PROPERTY);
        if (decimalSeparator != null) {
            try {
                builder.decimalSeparator(DecimalSeparator.valueOf(decimalSeparator.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException exception) {
                throw new IllegalArgumentException(
                    DECIMAL_SEPARATOR_PROPERTY + " must be POINT or COMMA, not \"" + decimalSeparator + "\"",
                    exception);
            }
        }

        String yesCode = properties.getProperty(YES_CODE_PROPERTY);
        if (yesCode != null) {
            builder.yesCode(parseCode(yesCode, YES_CODE_PROPERTY));
        }

        String noCode = properties.getProperty(NO_CODE_PROPERTY);
        if (noCode != null) {
            builder.noCode(parseCode(noCode, NO_CODE_PROPERTY));
        }

        String labelSetPrefix = properties.getProperty(LABEL_SET_PREFIX_PROPERTY);
        if (labelSetPrefix != null) {
            builder.labelSetPrefix(labelSetPrefix.trim());
        }

        try {
            return builder.build();
        } catch (IllegalStateException exception) {
            String message = exception.getMessage().
                replace("yesCode", YES_CODE_PROPERTY).
                replace("noCode", NO_CODE_PROPERTY);
            throw new IllegalArgumentException(message, exception);
        }
    }

    private static int parseCode(String value, String propertyName) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(propertyName + " must be an integer, not \"" + value + "\"", exception);
        }
    }

    private ExportOptions(Builder builder) {
        this.decimalSeparator = builder.decimalSeparator;
        this.yesCode = builder.yesCode;
        this.noCode = builder.noCode;
        this.labelSetPrefix = builder.labelSetPrefix;
        this.creationTime = builder.creationTime;
        this.variableNameSanitizer = builder.variableNameSanitizer;
        this.labelTextCleaner = builder.labelTextCleaner;
    }

    /**
     * @return The decimal separator that respondents use. This is never {@code null}.
     */
    public DecimalSeparator decimalSeparator() {
        return decimalSeparator;
    }

    /**
     * @return The code for "Yes".
     */
    public int yesCode() {
        return yesCode;
    }

    /**
     * @return The code for "No".
     */
    public int noCode() {
        return noCode;
    }

    /**
     * @return The prefix of value label names. This is never {@code null}.
     */
    public String labelSetPrefix() {
        return labelSetPrefix;
    }

    /**
     * @return The dataset's creation time. This is never {@code null}.
     */
    public LocalDateTime creationTime() {
        return creationTime;
    }

    /**
     * @return The function that turns field codes into variable names. This is never {@code null}.
     */
    public VariableNameSanitizer variableNameSanitizer() {
        return variableNameSanitizer;
    }

    /**
     * @return The function that removes markup from texts. This is never {@code null}.
     */
    public LabelTextCleaner labelTextCleaner() {
        return labelTextCleaner;
    }
}
