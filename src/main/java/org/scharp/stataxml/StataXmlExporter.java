///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exports survey responses as a Stata XML dataset.
 * <p>
 * The responses are buffered in memory until the exporter is closed, because the type of each variable depends on
 * every response.  Closing the exporter recodes the responses, infers the variable types, and writes the document.
 * </p>
 */
public final class StataXmlExporter implements AutoCloseable {

    private static final Logger log = Logger.getLogger(StataXmlExporter.class.getName());

    private final OutputStream outputStream;
    private final SurveyMetadata survey;
    private final ExportOptions options;
    private final int totalSelectedColumns;
    private final List<Column> columns;
    private final int[] selectedColumnIndexes;
    private final ValueLabelRegistry registry;
    private final ResponseMatrix matrix;

    private boolean isClosed;

    /**
     * Creates a {@code StataXmlExporter} that writes a Stata XML document to a file.
     * <p>
     * After creating the exporter, you must invoke {@link #addResponse addResponse()} for each response and then
     * {@link #close()} to write the document.
     * </p>
     *
     * @param targetLocation
     *     The path to the file to which the document should be written. If the file doesn't exist, then it will be
     *     created.  If the file does exist, then its contents will be replaced.
     * @param survey
     *     The survey whose responses are exported.
     * @param selectedColumns
     *     The keys of the columns to export, in the order in which they should appear in the dataset.  Columns that
     *     the survey doesn't know are dropped with a warning.
     * @param options
     *     The export options.
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or if {@code selectedColumns} contains a {@code null} key.
     * @throws IllegalArgumentException
     *     if more columns are selected than a Stata dataset can hold.
     * @throws IOException
     *     if the file couldn't be created.
     */
    public StataXmlExporter(Path targetLocation, SurveyMetadata survey, List<String> selectedColumns,
        ExportOptions options) throws IOException {
        this(openFile(targetLocation), survey, selectedColumns, options);
    }

    /**
     * Creates a {@code StataXmlExporter} that writes a Stata XML document to an output stream.
     * <p>
     * The exporter takes ownership of the stream and closes it when the exporter is closed.
     * </p>
     *
     * @param outputStream
     *     The stream to which the document should be written.
     * @param survey
     *     The survey whose responses are exported.
     * @param selectedColumns
     *     The keys of the columns to export, in the order in which they should appear in the dataset.  Columns that
     *     the survey doesn't know are dropped with a warning.
     * @param options
     *     The export options.
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or if {@code selectedColumns} contains a {@code null} key.
     * @throws IllegalArgumentException
     *     if more columns are selected than a Stata dataset can hold.
     */
    public StataXmlExporter(OutputStream outputStream, SurveyMetadata survey, List<String> selectedColumns,
        ExportOptions options) {
        ArgumentUtil.checkNotNull(outputStream, "outputStream");
        this.outputStream = outputStream;

        // Once the stream is owned by this exporter, it must be closed if construction fails.
        boolean success = false;
        try {
            ArgumentUtil.checkNotNull(survey, "survey");
            ArgumentUtil.checkNoNullElements(selectedColumns, "selectedColumns");
            ArgumentUtil.checkNotNull(options, "options");

            this.survey = survey;
            this.options = options;
            this.totalSelectedColumns = selectedColumns.size();
            this.columns = new MetadataNormalizer(survey, options).normalize(selectedColumns);

            // A response has a value for every selected column, including the dropped ones.
            Map<String, Integer> firstIndexOfKey = new HashMap<>(selectedColumns.size() * 2);
            for (int i = 0; i < selectedColumns.size(); i++) {
                firstIndexOfKey.putIfAbsent(selectedColumns.get(i), i);
            }
            this.selectedColumnIndexes = new int[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                selectedColumnIndexes[i] = firstIndexOfKey.get(columns.get(i).key());
            }

            this.registry = ValueLabelRegistry.build(columns, survey, options);
            this.matrix = new ResponseMatrix(columns.size());
            success = true;
        } finally {
            if (!success) {
                closeQuietly(outputStream);
            }
        }

        log.log(Level.FINE, "Exporting {0} of {1} selected columns from survey {2}",
            new Object[] { columns.size(), totalSelectedColumns, survey.surveyId() });
    }

    private static OutputStream openFile(Path targetLocation) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        return Files.newOutputStream(targetLocation);
    }

    private static void closeQuietly(OutputStream outputStream) {
        try {
            outputStream.close();
        } catch (IOException exception) {
            log.log(Level.WARNING, "Unable to close the output stream", exception);
        }
    }

    /**
     * Gets the columns that are exported.
     *
     * @return The columns, in dataset order.  This list is not modifiable.
     */
    public List<Column> columns() {
        return columns;
    }

    /**
     * Gets the value labels that are written to the dataset.
     *
     * @return The value label registry.
     */
    public ValueLabelRegistry valueLabels() {
        return registry;
    }

    /**
     * Appends a response (observation) to the dataset.
     *
     * @param response
     *     The raw values of the response, one for each column that was given to this exporter's constructor
     *     (including any that were dropped), in the same order.  A {@code null} value is treated as an empty value.
     *     <p>
     *     The values are immediately copied, so subsequent modifications to {@code response} don't change the
     *     dataset.
     *     </p>
     *
     * @throws NullPointerException
     *     if {@code response} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code response} doesn't have exactly one value for each selected column.
     * @throws IllegalStateException
     *     if this exporter has already been closed.
     */
    public void addResponse(List<String> response) {
        ArgumentUtil.checkNotNull(response, "response");
        if (isClosed) {
            throw new IllegalStateException("Cannot invoke addResponse on closed exporter");
        }
        if (response.size() != totalSelectedColumns) {
            throw new IllegalArgumentException("response has " + (totalSelectedColumns < response.size() ? "too many" :
                "too few") + " values, expected " + totalSelectedColumns + " but got " + response.size());
        }

        List<String> row = new ArrayList<>(selectedColumnIndexes.length);
        for (int selectedColumnIndex : selectedColumnIndexes) {
            row.add(response.get(selectedColumnIndex));
        }
        matrix.addRow(row);
    }

    /**
     * Recodes the responses, writes the dataset, and closes the output.
     * <p>
     * The output is closed even if writing fails.  This is safe to invoke multiple times; only the first invocation
     * writes the dataset.
     * </p>
     *
     * @throws MalformedTimestampException
     *     if a date/time column has a value that isn't a timestamp.  Nothing is written in this case.
     * @throws IOException
     *     if the dataset couldn't be written.
     */
    @Override
    public void close() throws IOException {
        if (isClosed) {
            return;
        }
        isClosed = true;

        try (OutputStream output = outputStream) {
            new Recoder(survey, options).recode(columns, matrix);
            TypeTable types = TypeInferrer.infer(columns, matrix);
            new StataXmlEmitter(survey, options, columns, registry, matrix, types).write(output);
        }

        log.log(Level.INFO, "Exported {0} responses to survey {1}",
            new Object[] { matrix.totalRows(), survey.surveyId() });
    }

    /**
     * Closes the output without writing the dataset.
     *
     * @param cause
     *     The problem that caused the export to be abandoned.  A failure to close the output is added to it as a
     *     suppressed exception.
     */
    private void abandon(RuntimeException cause) {
        isClosed = true;
        try {
            outputStream.close();
        } catch (IOException exception) {
            cause.addSuppressed(exception);
        }
    }

    /**
     * Writes a Stata XML dataset with the given responses to the file system.
     *
     * @param targetLocation
     *     The path to the file to which the document should be written. If the file doesn't exist, then it will be
     *     created.  If the file does exist, then its contents will be replaced.
     * @param survey
     *     The survey whose responses are exported.
     * @param selectedColumns
     *     The keys of the columns to export, in the order in which they should appear in the dataset.
     * @param responses
     *     The responses.  Each response is a list of raw values, one for each selected column, in the same order.
     * @param options
     *     The export options.
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or if {@code responses} contains a {@code null} response.
     * @throws IllegalArgumentException
     *     if a response doesn't have exactly one value for each selected column.
     * @throws MalformedTimestampException
     *     if a date/time column has a value that isn't a timestamp.
     * @throws IOException
     *     if a file I/O error prevented the dataset from being written.
     */
    public static void exportDataset(Path targetLocation, SurveyMetadata survey, List<String> selectedColumns,
        Iterable<List<String>> responses, ExportOptions options) throws IOException {
        ArgumentUtil.checkNotNull(responses, "responses");
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");

        try (StataXmlExporter exporter = new StataXmlExporter(targetLocation, survey, selectedColumns, options)) {
            try {
                for (List<String> response : responses) {
                    if (response == null) {
                        throw new NullPointerException("responses must not contain a null response");
                    }
                    exporter.addResponse(response);
                }
            } catch (RuntimeException exception) {
                // Don't write a dataset with only some of the responses.
                exporter.abandon(exception);
                throw exception;
            }
        }
    }
}
