///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites raw response values into the values that are written to the dataset.
 * <p>
 * Recoding a value that was already recoded does not change it.
 * </p>
 */
final class Recoder {

    private static final Logger log = Logger.getLogger(Recoder.class.getName());

    /**
     * The milliseconds between the UNIX epoch (1970-01-01) and the Stata epoch (1960-01-01), which is 3653 days.
     */
    static final long STATA_EPOCH_OFFSET_MILLIS = 315_619_200_000L;

    /** Dates, optionally followed by a time, separated by a space or 'T'. */
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder().
        append(DateTimeFormatter.ISO_LOCAL_DATE).
        optionalStart().
        optionalStart().appendLiteral('T').optionalEnd().
        optionalStart().appendLiteral(' ').optionalEnd().
        appendValue(ChronoField.HOUR_OF_DAY, 2).
        appendLiteral(':').
        appendValue(ChronoField.MINUTE_OF_HOUR, 2).
        optionalStart().
        appendLiteral(':').
        appendValue(ChronoField.SECOND_OF_MINUTE, 2).
        optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd().
        optionalEnd().
        optionalEnd().
        parseDefaulting(ChronoField.HOUR_OF_DAY, 0).
        parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0).
        parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0).
        toFormatter(Locale.ROOT).
        withResolverStyle(ResolverStyle.STRICT);

    private final SurveyMetadata survey;
    private final ExportOptions options;
    private final Map<LabelSetKey, Map<String, String>> answerTexts;

    Recoder(SurveyMetadata survey, ExportOptions options) {
        this.survey = survey;
        this.options = options;
        this.answerTexts = new HashMap<>();
    }

    /**
     * Recodes every cell of a response matrix in place.
     *
     * @param columns
     *     The columns of the matrix.
     * @param matrix
     *     The responses.
     *
     * @throws MalformedTimestampException
     *     if a date/time column has a value that isn't a timestamp.
     */
    void recode(List<Column> columns, ResponseMatrix matrix) {
        assert columns.size() == matrix.totalColumns();

        for (int row = 0; row < matrix.totalRows(); row++) {
            int i = 0;
            for (Column column : columns) {
                matrix.set(row, i, recodeCell(column, matrix.get(row, i), row));
                i++;
            }
        }
        log.log(Level.FINE, "Recoded {0} responses", matrix.totalRows());
    }

    /**
     * Recodes one value.
     *
     * @param column
     *     The value's column.
     * @param value
     *     The value.
     * @param rowNumber
     *     The zero-based number of the value's response, for error messages.
     *
     * @return The recoded value.
     *
     * @throws MalformedTimestampException
     *     if {@code column} is a date/time column and {@code value} isn't a timestamp.
     */
    String recodeCell(Column column, String value, int rowNumber) {
        String cell = value.trim();

        // Stata can only label integers, so non-integer codes are replaced with the answer text.
        if (column.usesAnswerText()) {
            String answerText = answerTexts(column).get(cell);
            if (answerText != null) {
                cell = answerText;
            }
        }

        if (cell.isEmpty()) {
            return cell;
        }

        switch (column.kind()) {
        case GENDER_CODE:
            cell = substitute(cell, "F", "0", "M", "1");
            break;

        case BOOLEAN_CODE:
            cell = substitute(cell, "Y", String.valueOf(options.yesCode()), "N", String.valueOf(options.noCode()),
                "U", "9");
            break;

        case TRI_STATE_CODE:
            cell = substitute(cell, "Y", "1", "N", "0", "U", "9");
            break;

        case FIVE_POINT_DIRECTION_CODE:
            cell = substitute(cell, "I", "1", "S", "0", "D", "-1");
            break;

        case MULTI_SELECT_INDICATOR:
            cell = substitute(cell, "Y", String.valueOf(options.yesCode()));
            break;

        case FREE_DATE:
            cell = toStataTimestamp(cell, column, rowNumber);
            break;

        default:
            break;
        }

        if (options.decimalSeparator() == DecimalSeparator.COMMA && cell.indexOf(',') != -1) {
            String pointDecimal = cell.replace(',', '.');
            if (NumericText.isNumber(pointDecimal)) {
                cell = pointDecimal;
            }
        }

        return cell;
    }

    /**
     * Replaces a cell which is exactly one of the given tokens with the token's replacement.
     *
     * @param cell
     *     The cell's value.
     * @param tokensAndReplacements
     *     Pairs of token and replacement.
     *
     * @return The replacement of the matching token, or {@code cell} if no token matches.
     */
    private static String substitute(String cell, String... tokensAndReplacements) {
        for (int i = 0; i < tokensAndReplacements.length; i += 2) {
            if (tokensAndReplacements[i].equals(cell)) {
                return tokensAndReplacements[i + 1];
            }
        }
        return cell;
    }

    /**
     * Converts a date/time into the number of milliseconds since 1960-01-01 00:00:00 UTC.
     */
    private static String toStataTimestamp(String cell, Column column, int rowNumber) {
        // A value that is already a timestamp is left as is.
        if (NumericText.isInteger(cell)) {
            return cell;
        }

        try {
            LocalDateTime timestamp = LocalDateTime.parse(cell, TIMESTAMP_FORMAT);
            long unixMillis = timestamp.toInstant(ZoneOffset.UTC).toEpochMilli();
            return String.valueOf(unixMillis + STATA_EPOCH_OFFSET_MILLIS);
        } catch (DateTimeParseException exception) {
            throw new MalformedTimestampException(rowNumber, column.name(), cell, exception);
        }
    }

    private Map<String, String> answerTexts(Column column) {
        return answerTexts.computeIfAbsent(LabelSetKey.of(column), key -> {
            Map<String, String> texts = new HashMap<>();
            for (Map.Entry<String, String> answer : survey.answers(key.questionId(), key.scaleId()).entrySet()) {
                texts.put(answer.getKey().trim(), options.labelTextCleaner().clean(answer.getValue()).trim());
            }
            return texts;
        });
    }
}
