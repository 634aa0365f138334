package org.scharp.stataxml;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ValueLabelRegistry}. */
public class ValueLabelRegistryTest {

    private static ValueLabelRegistry build(SurveyMetadata survey, ExportOptions options, String... selectedColumns) {
        List<Column> columns = new MetadataNormalizer(survey, options).normalize(List.of(selectedColumns));
        return ValueLabelRegistry.build(columns, survey, options);
    }

    private static ValueLabelRegistry build(SurveyMetadata survey, String... selectedColumns) {
        return build(survey, ExportOptions.builder().build(), selectedColumns);
    }

    private static Map<Integer, String> entries(Object... codesAndTexts) {
        Map<Integer, String> entries = new TreeMap<>();
        for (int i = 0; i < codesAndTexts.length; i += 2) {
            entries.put((Integer) codesAndTexts[i], (String) codesAndTexts[i + 1]);
        }
        return entries;
    }

    @Test
    void testFixedLabels() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(TestSurvey.question("G", 1, 'G', "Gender")).
            field(TestSurvey.question("Y", 2, 'Y', "Vote")).
            field(TestSurvey.question("C", 3, 'C', "Agree")).
            field(TestSurvey.question("E", 4, 'E', "Trend")).
            field(TestSurvey.question("M", 5, 'M', "Pick"));

        ValueLabelRegistry registry = build(survey, "G", "Y", "C", "E", "M");
        List<LabelSet> labelSets = registry.labelSets();
        assertEquals(5, labelSets.size());

        assertEquals("vall10", labelSets.get(0).name());
        assertEquals(entries(0, "Female", 1, "Male"), labelSets.get(0).entries());

        assertEquals("vall20", labelSets.get(1).name());
        assertEquals(entries(0, "No", 1, "Yes"), labelSets.get(1).entries());

        assertEquals("vall30", labelSets.get(2).name());
        assertEquals(entries(0, "No", 1, "Yes", 9, "Uncertain"), labelSets.get(2).entries());

        assertEquals("vall40", labelSets.get(3).name());
        assertEquals(entries(-1, "Decrease", 0, "Same", 1, "Increase"), labelSets.get(3).entries());

        assertEquals("vall50", labelSets.get(4).name());
        assertEquals(entries(0, "Not Selected", 1, "Yes"), labelSets.get(4).entries());
        assertEquals(5, labelSets.get(4).questionId());
        assertEquals(0, labelSets.get(4).scaleId());
    }

    @Test
    void testConfiguredCodesAndTranslations() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(TestSurvey.question("Y", 2, 'Y', "Vote")).
            field(TestSurvey.question("M", 5, 'M', "Pick")).
            translation(FixedLabel.YES, "Ja").
            translation(FixedLabel.NO, "Nein");
        ExportOptions options = ExportOptions.builder().yesCode(1).noCode(2).labelSetPrefix("lbl").build();

        List<LabelSet> labelSets = build(survey, options, "Y", "M").labelSets();
        assertEquals("lbl20", labelSets.get(0).name());
        assertEquals(entries(1, "Ja", 2, "Nein"), labelSets.get(0).entries());
        assertEquals("lbl50", labelSets.get(1).name());
        assertEquals(entries(0, "Not Selected", 1, "Ja"), labelSets.get(1).entries());
    }

    @Test
    void testSurveyAnswers() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(TestSurvey.question("Q1", 7, 'L', "Color")).
            answers(7, 0, "3", "<b>Blue</b>", "1", "Red", " 2 ", "Green");

        ValueLabelRegistry registry = build(survey, "Q1");
        assertEquals(1, registry.labelSets().size());

        LabelSet labelSet = registry.labelSets().get(0);
        assertEquals("vall70", labelSet.name());
        assertEquals(entries(1, "Red", 2, "Green", 3, "Blue"), labelSet.entries());
        assertEquals(List.of(1, 2, 3), List.copyOf(labelSet.entries().keySet()));

        assertThrows(UnsupportedOperationException.class, () -> labelSet.entries().put(4, "Black"));
        assertThrows(UnsupportedOperationException.class, () -> registry.labelSets().clear());
    }

    @Test
    void testFixedLabelsReplaceSurveyAnswers() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(TestSurvey.question("G", 1, 'G', "Gender")).
            answers(1, 0, "0", "Woman", "2", "Diverse");

        LabelSet labelSet = build(survey, "G").labelSets().get(0);
        assertEquals(entries(0, "Female", 1, "Male", 2, "Diverse"), labelSet.entries());
    }

    @Test
    void testEachScaleHasItsOwnLabelSet() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field("Q1#0", QuestionField.builder().fieldCode("Q1_0").questionId(8).scaleId(0).build()).
            field("Q1#1", QuestionField.builder().fieldCode("Q1_1").questionId(8).scaleId(1).build()).
            field("Q1#0b", QuestionField.builder().fieldCode("Q1_0b").questionId(8).scaleId(0).build()).
            answers(8, 0, "1", "Good", "2", "Bad").
            answers(8, 1, "1", "Important", "2", "Unimportant");

        ValueLabelRegistry registry = build(survey, "Q1#0", "Q1#1", "Q1#0b");
        List<LabelSet> labelSets = registry.labelSets();

        assertEquals(2, labelSets.size());
        assertEquals("vall80", labelSets.get(0).name());
        assertEquals(entries(1, "Good", 2, "Bad"), labelSets.get(0).entries());
        assertEquals("vall81", labelSets.get(1).name());
        assertEquals(entries(1, "Important", 2, "Unimportant"), labelSets.get(1).entries());
    }

    @Test
    void testNameCollision() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(QuestionField.builder().fieldCode("A").questionId(1).scaleId(23).build()).
            field(QuestionField.builder().fieldCode("B").questionId(12).scaleId(3).build()).
            answers(1, 23, "1", "One").
            answers(12, 3, "1", "Uno");

        List<LabelSet> labelSets = build(survey, "A", "B").labelSets();
        assertEquals("vall123", labelSets.get(0).name());
        assertEquals("vall12_3", labelSets.get(1).name());
    }

    @Test
    void testUnlabelableColumns() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(TestSurvey.question("Q1", 1, 'L', "Letters")).
            field(QuestionField.builder().fieldCode("Q2other").questionId(2).questionType('L').other(true).build()).
            field(TestSurvey.question("Q3comment", 3, 'P', "Comment")).
            answers(1, 0, "A1", "First").
            answers(2, 0, "1", "One").
            answers(3, 0, "1", "One");

        ValueLabelRegistry registry = build(survey, "Q1", "Q2other", "Q3comment");
        assertThat(registry.labelSets(), empty());
        assertFalse(registry.contains("vall10"));
        assertFalse(registry.contains("vall20"));
        assertFalse(registry.contains("vall30"));
    }

    @Test
    void testLabelSetFor() {
        TestSurvey survey = new TestSurvey("1", "Test").
            field(TestSurvey.systemField("id")).
            field(TestSurvey.question("Q1", 1, 'Y', "Vote")).
            field(QuestionField.builder().fieldCode("Q1other").questionId(1).questionType('Y').other(true).build());
        ExportOptions options = ExportOptions.builder().build();
        List<Column> columns = new MetadataNormalizer(survey, options).normalize(List.of("id", "Q1", "Q1other"));
        ValueLabelRegistry registry = ValueLabelRegistry.build(columns, survey, options);

        // A column without answers has no label set.
        assertEquals(Optional.empty(), registry.labelSetFor(columns.get(0)));

        Optional<LabelSet> labelSet = registry.labelSetFor(columns.get(1));
        assertTrue(labelSet.isPresent());
        assertEquals("vall10", labelSet.get().name());
        assertTrue(registry.contains("vall10"));

        // An "other" column never has a label set, even if its question has one.
        assertEquals(Optional.empty(), registry.labelSetFor(columns.get(2)));

        Exception exception = assertThrows(NullPointerException.class, () -> registry.labelSetFor(null));
        assertEquals("column must not be null", exception.getMessage());
    }
}
