///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.Map;

/**
 * The category of a survey column, which determines how its responses are recoded and whether it gets a fixed set of
 * value labels.
 */
public enum SemanticKind {
    /** A date or date/time that is converted to a Stata timestamp. */
    FREE_DATE,

    /** Free text. */
    FREE_STRING,

    /** A small numeric identifier, such as the last page a respondent saw. */
    SMALL_IDENTIFIER,

    /** A numeric identifier or numeric input. */
    NUMERIC_ID,

    /** Female/Male, answered as {@code F}/{@code M}. */
    GENDER_CODE,

    /** Yes/No, answered as {@code Y}/{@code N}. */
    BOOLEAN_CODE,

    /** Yes/No/Uncertain, answered as {@code Y}/{@code N}/{@code U}. */
    TRI_STATE_CODE,

    /** Increase/Same/Decrease, answered as {@code I}/{@code S}/{@code D}. */
    FIVE_POINT_DIRECTION_CODE,

    /** The indicator of whether one option of a multiple choice question was selected. */
    MULTI_SELECT_INDICATOR,

    /** Anything else. */
    GENERIC;

    private static final Map<String, SemanticKind> SYSTEM_FIELDS = Map.of(
        "submitdate", FREE_DATE,
        "startdate", FREE_DATE,
        "datestamp", FREE_DATE,
        "startlanguage", FREE_STRING,
        "token", FREE_STRING,
        "ipaddr", FREE_STRING,
        "refurl", FREE_STRING,
        "id", NUMERIC_ID,
        "lastpage", SMALL_IDENTIFIER);

    /**
     * Determines the kind of a column from its field code and the type code of its question.
     * <p>
     * The fields that every survey has (like "submitdate" or "id") have a fixed kind.  All other fields take their kind
     * from their question's type.
     * </p>
     *
     * @param fieldCode
     *     The column's field code.
     * @param questionType
     *     The single character type code of the column's question.
     *
     * @return The column's kind.  This is never {@code null}.
     */
    public static SemanticKind of(String fieldCode, char questionType) {
        ArgumentUtil.checkNotNull(fieldCode, "fieldCode");

        SemanticKind systemFieldKind = SYSTEM_FIELDS.get(fieldCode);
        return systemFieldKind != null ? systemFieldKind : ofQuestionType(questionType);
    }

    /**
     * Determines the kind of a column from the type code of its question.
     *
     * @param questionType
     *     The single character type code of the question.
     *
     * @return The matching kind, or {@link #GENERIC} if the type code doesn't have a special meaning.
     */
    static SemanticKind ofQuestionType(char questionType) {
        switch (questionType) {
        case 'D':
            return FREE_DATE;

        case 'S': // short free text
        case 'T': // long free text
        case 'U': // huge free text
        case 'Q': // multiple short text
        case ';': // array of texts
            return FREE_STRING;

        case 'N': // numerical input
        case 'K': // multiple numerical input
            return NUMERIC_ID;

        case 'G':
            return GENDER_CODE;

        case 'Y':
            return BOOLEAN_CODE;

        case 'C':
            return TRI_STATE_CODE;

        case 'E':
            return FIVE_POINT_DIRECTION_CODE;

        case 'M': // multiple choice
        case 'P': // multiple choice with comments
            return MULTI_SELECT_INDICATOR;

        default:
            return GENERIC;
        }
    }

    /**
     * Gets whether columns of this kind are given a fixed set of value labels, regardless of the answers that the
     * survey defines.
     *
     * @return {@code true}, if this kind has fixed codes; {@code false}, otherwise.
     */
    public boolean hasFixedCodes() {
        switch (this) {
        case GENDER_CODE:
        case BOOLEAN_CODE:
        case TRI_STATE_CODE:
        case FIVE_POINT_DIRECTION_CODE:
        case MULTI_SELECT_INDICATOR:
            return true;

        default:
            return false;
        }
    }
}
