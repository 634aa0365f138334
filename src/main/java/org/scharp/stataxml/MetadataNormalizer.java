///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the survey's description of the selected columns into {@link Column} objects.
 */
final class MetadataNormalizer {

    private static final Logger log = Logger.getLogger(MetadataNormalizer.class.getName());

    /** The most variables that a Stata dataset can have. */
    static final int MAX_VARIABLES = Short.MAX_VALUE;

    private final SurveyMetadata survey;
    private final VariableNameSanitizer variableNameSanitizer;
    private final LabelTextCleaner labelTextCleaner;

    MetadataNormalizer(SurveyMetadata survey, ExportOptions options) {
        this.survey = survey;
        this.variableNameSanitizer = options.variableNameSanitizer();
        this.labelTextCleaner = options.labelTextCleaner();
    }

    /**
     * Creates a column for each selected column key that the survey knows.
     * <p>
     * Column keys that the survey doesn't know are dropped with a warning.
     * </p>
     *
     * @param selectedColumnKeys
     *     The keys of the selected columns, in the order in which they should appear in the dataset.
     *
     * @return The columns, in selection order.  This list is not modifiable.
     *
     * @throws IllegalArgumentException
     *     if more columns are selected than a Stata dataset can hold.
     */
    List<Column> normalize(List<String> selectedColumnKeys) {
        if (MAX_VARIABLES < selectedColumnKeys.size()) {
            throw new IllegalArgumentException("A Stata dataset cannot have more than " + MAX_VARIABLES + " variables");
        }

        // Resolve the fields, dropping the ones that the survey doesn't know.
        Map<String, QuestionField> fields = new LinkedHashMap<>();
        for (String columnKey : selectedColumnKeys) {
            if (fields.containsKey(columnKey)) {
                log.log(Level.WARNING, "Column \"{0}\" was selected more than once; it is exported once", columnKey);
                continue;
            }

            Optional<QuestionField> field = survey.field(columnKey);
            if (field.isEmpty()) {
                log.log(Level.WARNING, "Survey {0} has no column \"{1}\"; it is dropped from the export",
                    new Object[] { survey.surveyId(), columnKey });
                continue;
            }
            fields.put(columnKey, field.get());
        }

        Set<Integer> questionsWithNonNumericCodes = findQuestionsWithNonNumericCodes(fields.values());

        List<Column> columns = new ArrayList<>(fields.size());
        Set<String> usedNames = new HashSet<>(fields.size() * 2);
        for (Map.Entry<String, QuestionField> entry : fields.entrySet()) {
            String columnKey = entry.getKey();
            QuestionField field = entry.getValue();

            Column column = new Column(
                columnKey,
                uniqueName(variableNameSanitizer.sanitize(field.fieldCode()), usedNames),
                variableLabel(field),
                SemanticKind.of(field.fieldCode(), field.questionType()),
                field.questionId(),
                field.scaleId(),
                questionsWithNonNumericCodes.contains(field.questionId()),
                field.isOther() || columnKey.endsWith("comment"));

            log.log(Level.FINE, "Column {0} is {1}", new Object[] { column, column.kind() });
            columns.add(column);
        }

        return Collections.unmodifiableList(columns);
    }

    /**
     * Finds the questions which have an answer code, on any of their selected scales, that can't be a Stata value
     * label.
     */
    private Set<Integer> findQuestionsWithNonNumericCodes(Iterable<QuestionField> fields) {
        Map<Integer, Set<Integer>> scalesOfQuestion = new HashMap<>();
        for (QuestionField field : fields) {
            scalesOfQuestion.computeIfAbsent(field.questionId(), questionId -> new TreeSet<>()).add(field.scaleId());
        }

        Set<Integer> questionIds = new HashSet<>();
        for (Map.Entry<Integer, Set<Integer>> entry : scalesOfQuestion.entrySet()) {
            int questionId = entry.getKey();
            for (int scaleId : entry.getValue()) {
                for (String code : survey.answers(questionId, scaleId).keySet()) {
                    if (!NumericText.isLabelCode(code)) {
                        questionIds.add(questionId);
                    }
                }
            }
        }
        return questionIds;
    }

    /**
     * Makes the variable label: the question text, preceded by the bracketed texts of the sub-questions and scale.
     */
    private String variableLabel(QuestionField field) {
        StringBuilder label = new StringBuilder();
        appendQualifier(label, field.subQuestion1());
        appendQualifier(label, field.subQuestion2());
        appendQualifier(label, field.subQuestion());
        appendQualifier(label, field.scale());
        label.append(labelTextCleaner.clean(field.questionText()));
        return label.toString().trim();
    }

    private void appendQualifier(StringBuilder label, String qualifier) {
        String cleanQualifier = labelTextCleaner.clean(qualifier);
        if (!cleanQualifier.isEmpty()) {
            label.append('[').append(cleanQualifier).append("] ");
        }
    }

    /**
     * Stata rejects a dataset with two variables of the same name, so a sanitized name that is already used gets a
     * numeric suffix.
     */
    private static String uniqueName(String name, Set<String> usedNames) {
        if (name == null || name.isEmpty()) {
            throw new IllegalStateException("the variable name sanitizer returned a blank name");
        }

        String uniqueName = name;
        for (int suffix = 2; !usedNames.add(uniqueName); suffix++) {
            String suffixText = "_" + suffix;
            int baseLength = Math.min(name.length(), StataVariableNameSanitizer.MAX_NAME_LENGTH - suffixText.length());
            uniqueName = name.substring(0, baseLength) + suffixText;
        }
        return uniqueName;
    }
}
