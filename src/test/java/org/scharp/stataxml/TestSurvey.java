package org.scharp.stataxml;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An in-memory {@link SurveyMetadata} for tests.
 */
public class TestSurvey implements SurveyMetadata {

    private final String surveyId;
    private final String title;
    private final Map<String, QuestionField> fields;
    private final Map<List<Integer>, Map<String, String>> answers;
    private final Map<FixedLabel, String> translations;

    public TestSurvey(String surveyId, String title) {
        this.surveyId = surveyId;
        this.title = title;
        this.fields = new LinkedHashMap<>();
        this.answers = new HashMap<>();
        this.translations = new HashMap<>();
    }

    /**
     * Creates a field for question with a given type.
     */
    public static QuestionField question(String fieldCode, int questionId, char questionType, String questionText) {
        return QuestionField.builder().
            fieldCode(fieldCode).
            questionId(questionId).
            questionType(questionType).
            questionText(questionText).
            build();
    }

    /**
     * Creates a field for a system column, like "id" or "submitdate".
     */
    public static QuestionField systemField(String fieldCode) {
        return QuestionField.builder().fieldCode(fieldCode).build();
    }

    /**
     * Adds a field whose column key is its field code.
     */
    public TestSurvey field(QuestionField field) {
        return field(field.fieldCode(), field);
    }

    public TestSurvey field(String columnKey, QuestionField field) {
        fields.put(columnKey, field);
        return this;
    }

    /**
     * Defines the answers of a question's scale.
     *
     * @param codesAndTexts
     *     pairs of answer code and answer text.
     */
    public TestSurvey answers(int questionId, int scaleId, String... codesAndTexts) {
        Map<String, String> scaleAnswers = new LinkedHashMap<>();
        for (int i = 0; i < codesAndTexts.length; i += 2) {
            scaleAnswers.put(codesAndTexts[i], codesAndTexts[i + 1]);
        }
        answers.put(List.of(questionId, scaleId), scaleAnswers);
        return this;
    }

    public TestSurvey translation(FixedLabel label, String text) {
        translations.put(label, text);
        return this;
    }

    @Override
    public String surveyId() {
        return surveyId;
    }

    @Override
    public String title() {
        return title;
    }

    @Override
    public Optional<QuestionField> field(String columnKey) {
        return Optional.ofNullable(fields.get(columnKey));
    }

    @Override
    public Map<String, String> answers(int questionId, int scaleId) {
        return answers.getOrDefault(List.of(questionId, scaleId), Collections.emptyMap());
    }

    @Override
    public String translate(FixedLabel label) {
        return translations.getOrDefault(label, label.englishText());
    }
}
