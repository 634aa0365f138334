///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.Map;
import java.util.Optional;

/**
 * The survey whose responses are exported.  This is implemented by the host application.
 * <p>
 * All texts are given in the language in which the survey is exported.  They may contain HTML, which is removed by the
 * {@link LabelTextCleaner} before it is written.
 * </p>
 */
public interface SurveyMetadata {

    /**
     * Gets the survey's identity, which is written into the dataset label.
     *
     * @return The survey's identity. This is never {@code null}.
     */
    String surveyId();

    /**
     * Gets the survey's title.
     *
     * @return The survey's title. This is never {@code null}.
     */
    String title();

    /**
     * Looks up the field which describes a response column.
     *
     * @param columnKey
     *     The key of the column, as it was selected for export.
     *
     * @return The field, or an empty {@code Optional} if the survey doesn't know the column.
     */
    Optional<QuestionField> field(String columnKey);

    /**
     * Gets the answers that a question defines on one of its scales.
     *
     * @param questionId
     *     The question's identity.
     * @param scaleId
     *     The scale's identity.
     *
     * @return A map from answer code to answer text, in the survey's answer order. This is empty (never {@code null})
     *     if the question has no answers on the scale.
     */
    Map<String, String> answers(int questionId, int scaleId);

    /**
     * Translates the text of a synthesized value label into the survey's language.
     * <p>
     * The default implementation returns the English text.
     * </p>
     *
     * @param label
     *     The label to translate.
     *
     * @return The translated text. This is never {@code null}.
     */
    default String translate(FixedLabel label) {
        return label.englishText();
    }
}
