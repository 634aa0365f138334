///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The value labels of a dataset.
 * <p>
 * A label set is made for each scale of a question that has at least one column to which value labels may be attached
 * (see {@link Column#isLabelable()}).  Its entries are the answers that the survey defines for the scale, plus the
 * fixed labels of gender, Yes/No, Yes/No/Uncertain, Increase/Same/Decrease, and multiple choice questions.  A scale
 * without any entries gets no label set.
 * </p>
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class ValueLabelRegistry {

    private static final Logger log = Logger.getLogger(ValueLabelRegistry.class.getName());

    private final Map<LabelSetKey, LabelSet> labelSets;
    private final Set<String> names;

    private ValueLabelRegistry(Map<LabelSetKey, LabelSet> labelSets) {
        this.labelSets = labelSets;
        this.names = new HashSet<>();
        for (LabelSet labelSet : labelSets.values()) {
            names.add(labelSet.name());
        }
    }

    /**
     * Builds the label sets for a dataset's columns.
     *
     * @param columns
     *     The dataset's columns.
     * @param survey
     *     The survey that supplies answer texts and the translations of the fixed labels.
     * @param options
     *     The export options, which supply the codes for "Yes" and "No", the prefix of label set names, and the text
     *     cleaner.
     *
     * @return A registry.
     */
    static ValueLabelRegistry build(List<Column> columns, SurveyMetadata survey, ExportOptions options) {
        Map<LabelSetKey, LabelSet> labelSets = new LinkedHashMap<>();
        Set<LabelSetKey> visitedKeys = new HashSet<>();
        Set<String> usedNames = new HashSet<>();

        for (Column column : columns) {
            if (!column.isLabelable()) {
                continue;
            }

            LabelSetKey key = LabelSetKey.of(column);
            if (!visitedKeys.add(key)) {
                continue; // another column of the same scale was already seen
            }

            SortedMap<Integer, String> entries = new TreeMap<>();
            for (Map.Entry<String, String> answer : survey.answers(key.questionId(), key.scaleId()).entrySet()) {
                entries.put(
                    Integer.parseInt(answer.getKey().trim()),
                    options.labelTextCleaner().clean(answer.getValue()));
            }
            addFixedLabels(entries, column.kind(), survey, options);

            if (entries.isEmpty()) {
                log.log(Level.FINE, "Column {0} has no value labels", column);
                continue;
            }

            // Question 1 scale 23 and question 12 scale 3 would both be named "vall123".
            String name = options.labelSetPrefix() + key.questionId() + key.scaleId();
            if (!usedNames.add(name)) {
                name = options.labelSetPrefix() + key.questionId() + "_" + key.scaleId();
                usedNames.add(name);
            }
            labelSets.put(key, new LabelSet(name, key, entries));
        }

        return new ValueLabelRegistry(labelSets);
    }

    /**
     * Adds the labels that a kind of column always has.  These replace any answers the survey defines with the same
     * code.
     */
    private static void addFixedLabels(SortedMap<Integer, String> entries, SemanticKind kind, SurveyMetadata survey,
        ExportOptions options) {
        switch (kind) {
        case GENDER_CODE:
            entries.put(0, survey.translate(FixedLabel.FEMALE));
            entries.put(1, survey.translate(FixedLabel.MALE));
            break;

        case BOOLEAN_CODE:
            entries.put(options.yesCode(), survey.translate(FixedLabel.YES));
            entries.put(options.noCode(), survey.translate(FixedLabel.NO));
            break;

        case TRI_STATE_CODE:
            entries.put(1, survey.translate(FixedLabel.YES));
            entries.put(0, survey.translate(FixedLabel.NO));
            entries.put(9, survey.translate(FixedLabel.UNCERTAIN));
            break;

        case FIVE_POINT_DIRECTION_CODE:
            entries.put(1, survey.translate(FixedLabel.INCREASE));
            entries.put(0, survey.translate(FixedLabel.SAME));
            entries.put(-1, survey.translate(FixedLabel.DECREASE));
            break;

        case MULTI_SELECT_INDICATOR:
            entries.put(0, survey.translate(FixedLabel.NOT_SELECTED));
            entries.put(options.yesCode(), survey.translate(FixedLabel.YES));
            break;

        default:
            assert !kind.hasFixedCodes() : kind + " has fixed codes but no labels";
            break;
        }
    }

    /**
     * Gets the label set that is attached to a column.
     *
     * @param column
     *     The column.
     *
     * @return The column's label set, or an empty {@code Optional} if the column has none.
     */
    public Optional<LabelSet> labelSetFor(Column column) {
        ArgumentUtil.checkNotNull(column, "column");

        if (!column.isLabelable()) {
            return Optional.empty();
        }
        return Optional.ofNullable(labelSets.get(LabelSetKey.of(column)));
    }

    /**
     * Gets whether a label set with the given name was registered.
     *
     * @param name
     *     The label set's name.
     *
     * @return {@code true}, if this registry has a label set named {@code name}.
     */
    public boolean contains(String name) {
        return names.contains(name);
    }

    /**
     * Gets all label sets, in the order of the first column that uses each of them.
     * <p>
     * The returned list is not modifiable.
     * </p>
     *
     * @return The label sets. This is never {@code null}.
     */
    public List<LabelSet> labelSets() {
        return Collections.unmodifiableList(new ArrayList<>(labelSets.values()));
    }
}
