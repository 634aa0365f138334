///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.OutputStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializes a recoded, typed dataset as a Stata XML document (format 113).
 */
final class StataXmlEmitter {

    private static final Logger log = Logger.getLogger(StataXmlEmitter.class.getName());

    static final int DS_FORMAT = 113;

    private static final DateTimeFormatter TIME_STAMP_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm",
        Locale.ENGLISH);

    private final SurveyMetadata survey;
    private final ExportOptions options;
    private final List<Column> columns;
    private final ValueLabelRegistry registry;
    private final ResponseMatrix matrix;
    private final TypeTable types;

    StataXmlEmitter(SurveyMetadata survey, ExportOptions options, List<Column> columns, ValueLabelRegistry registry,
        ResponseMatrix matrix, TypeTable types) {
        assert columns.size() == matrix.totalColumns();

        this.survey = survey;
        this.options = options;
        this.columns = columns;
        this.registry = registry;
        this.matrix = matrix;
        this.types = types;
    }

    /**
     * Builds the document.
     *
     * @return The Stata XML document.
     *
     * @throws IllegalStateException
     *     if a column references a label set that isn't registered or has no inferred type.
     * @throws IOException
     *     if the XML parser couldn't be configured.
     */
    Document buildDocument() throws IOException {
        final Document document;
        try {
            document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException exception) {
            throw new IOException("unable to create an XML document", exception);
        }
        document.setXmlStandalone(true);

        Element dta = document.createElement("dta");
        document.appendChild(dta);

        dta.appendChild(header(document));
        dta.appendChild(descriptors(document));
        dta.appendChild(variableLabels(document));
        dta.appendChild(data(document));
        dta.appendChild(valueLabels(document));

        return document;
    }

    /**
     * Writes the document to an output stream as UTF-8.  The stream is not closed.
     *
     * @param outputStream
     *     The stream to which the document is written.
     *
     * @throws IllegalStateException
     *     if a column references a label set that isn't registered or has no inferred type.
     * @throws IOException
     *     if the document couldn't be serialized or written.
     */
    void write(OutputStream outputStream) throws IOException {
        Document document = buildDocument();
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.transform(new DOMSource(document), new StreamResult(outputStream));
        } catch (TransformerException exception) {
            throw new IOException("unable to write the Stata XML document", exception);
        }
        outputStream.flush();

        log.log(Level.FINE, "Wrote {0} variables and {1} observations for survey {2}",
            new Object[] { columns.size(), matrix.totalRows(), survey.surveyId() });
    }

    private Element header(Document document) {
        Element header = document.createElement("header");
        appendTextElement(header, "ds_format", String.valueOf(DS_FORMAT));
        appendTextElement(header, "byteorder", "LOHI");
        appendTextElement(header, "filetype", "1");
        appendTextElement(header, "nvar", String.valueOf(columns.size()));
        appendTextElement(header, "nobs", String.valueOf(matrix.totalRows()));
        appendTextElement(header, "data_label", survey.title() + " (SID: " + survey.surveyId() + ")");
        appendTextElement(header, "time_stamp", TIME_STAMP_FORMAT.format(options.creationTime()));
        return header;
    }

    private Element descriptors(Document document) {
        Element descriptors = document.createElement("descriptors");

        Element typelist = appendElement(descriptors, "typelist");
        for (Column column : columns) {
            appendVariableElement(typelist, "type", column, types.typeOf(column).token());
        }

        Element varlist = appendElement(descriptors, "varlist");
        for (Column column : columns) {
            appendElement(varlist, "variable").setAttribute("varname", column.name());
        }

        // The dataset is never sorted.
        appendElement(descriptors, "srtlist");

        Element fmtlist = appendElement(descriptors, "fmtlist");
        for (Column column : columns) {
            appendVariableElement(fmtlist, "fmt", column, types.typeOf(column).displayFormat().toString());
        }

        Element lbllist = appendElement(descriptors, "lbllist");
        for (Column column : columns) {
            appendVariableElement(lbllist, "lblname", column, labelSetName(column));
        }

        return descriptors;
    }

    /**
     * Gets the name of a column's label set, or "" if it has none.
     *
     * @throws IllegalStateException
     *     if the column has fixed codes but the registry has no label set for it, which means that the registry was
     *     built for other columns.
     */
    private String labelSetName(Column column) {
        Optional<LabelSet> labelSet = registry.labelSetFor(column);
        if (labelSet.isPresent()) {
            return labelSet.get().name();
        }

        // The fixed codes always make a non-empty label set.
        if (column.isLabelable() && column.kind().hasFixedCodes()) {
            throw new IllegalStateException(column + " has fixed codes but no registered label set");
        }
        return "";
    }

    private Element variableLabels(Document document) {
        Element variableLabels = document.createElement("variable_labels");
        for (Column column : columns) {
            appendVariableElement(variableLabels, "vlabel", column, column.label());
        }
        return variableLabels;
    }

    private Element data(Document document) {
        Element data = document.createElement("data");
        for (int row = 0; row < matrix.totalRows(); row++) {
            Element observation = appendElement(data, "o");
            observation.setAttribute("num", String.valueOf(row));

            int i = 0;
            for (Column column : columns) {
                String value = matrix.get(row, i);
                ColumnType type = types.typeOf(column);
                if (type.storageType() == StorageType.STRING) {
                    value = WriteUtil.truncateUtf8(value, type.width());
                }
                appendVariableElement(observation, "v", column, value);
                i++;
            }
        }
        return data;
    }

    private Element valueLabels(Document document) {
        Element valueLabels = document.createElement("value_labels");
        for (LabelSet labelSet : registry.labelSets()) {
            Element vallab = appendElement(valueLabels, "vallab");
            vallab.setAttribute("name", labelSet.name());
            for (Map.Entry<Integer, String> entry : labelSet.entries().entrySet()) {
                Element label = appendTextElement(vallab, "label", entry.getValue());
                label.setAttribute("value", String.valueOf(entry.getKey()));
            }
        }
        return valueLabels;
    }

    private static Element appendElement(Element parent, String name) {
        Element child = parent.getOwnerDocument().createElement(name);
        parent.appendChild(child);
        return child;
    }

    private static Element appendTextElement(Element parent, String name, String text) {
        Element child = appendElement(parent, name);
        child.setTextContent(xmlCharacters(text));
        return child;
    }

    private static void appendVariableElement(Element parent, String name, Column column, String text) {
        appendTextElement(parent, name, text).setAttribute("varname", column.name());
    }

    /**
     * Removes the characters that XML 1.0 documents can't contain, even as character references.
     */
    static String xmlCharacters(String text) {
        StringBuilder legal = null;
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            boolean isLegal = codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD ||
                (0x20 <= codePoint && codePoint <= 0xD7FF) ||
                (0xE000 <= codePoint && codePoint <= 0xFFFD) ||
                (0x10000 <= codePoint && codePoint <= 0x10FFFF);

            if (!isLegal && legal == null) {
                legal = new StringBuilder(text.length());
                legal.append(text, 0, offset);
            } else if (isLegal && legal != null) {
                legal.appendCodePoint(codePoint);
            }
            offset += Character.charCount(codePoint);
        }
        return legal == null ? text : legal.toString();
    }
}
