///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library exports survey responses as Stata XML documents, which Stata reads with
 * {@code xmluse "file.xml", doctype(dta)}.
 * </p>
 *
 * <p>
 * The host application describes its survey by implementing {@link org.scharp.stataxml.SurveyMetadata} and gives the
 * responses as lists of raw strings.  For example:
 * </p>
 *
 * <pre>{@code
 * ExportOptions options = ExportOptions.builder().
 *     decimalSeparator(DecimalSeparator.COMMA).
 *     build();
 *
 * List<String> selectedColumns = List.of("id", "submitdate", "123X4X56", "123X4X57");
 * List<List<String>> responses = List.of(
 *     List.of("1", "2024-03-01 09:15:00", "F", "Y"),
 *     List.of("2", "2024-03-02 17:45:30", "M", "N"),
 *     List.of("3", "", "", "U"));
 *
 * StataXmlExporter.exportDataset(Path.of("survey.xml"), survey, selectedColumns, responses, options);
 * }</pre>
 *
 * <h2>A Stata Primer for Java Programmers</h2>
 *
 * <p>
 * In Stata, a row of data is called an "observation" and a column is called a "variable".  Each variable has a
 * storage type which is chosen when the dataset is written.  The numeric types are {@code byte}, {@code int},
 * {@code long}, {@code float}, and {@code double}.  The integer types don't use their full two's complement ranges,
 * because Stata reserves the largest values of each type for its missing values ({@code .}, {@code .a} through
 * {@code .z}).  For example, a {@code byte} holds -127 through 100.  String variables have a fixed width of 1 to 244
 * bytes ({@code str1} through {@code str244}).  This library chooses the narrowest type that holds all of a variable's
 * values and writes strings as UTF-8.
 * </p>
 *
 * <p>
 * Like SAS, Stata has no date type.  A date/time is a {@code double} that counts the milliseconds since
 * 1960-01-01 00:00:00 and is displayed with the {@code %tc} format.  This library treats all date/times as UTC.
 * </p>
 *
 * <p>
 * A numeric variable may refer to a "value label", which is a named mapping from integer codes to texts.  This is how
 * Stata stores categorical answers.  For example, the answers to a Yes/No question are stored as 1 and 0 with a value
 * label that maps 1 to "Yes" and 0 to "No".  Value labels can only be attached to integers, so a question whose answer
 * codes aren't integers is exported with the text of its answers instead of its codes.
 * </p>
 *
 * <p>
 * Variable names must begin with a letter or an underscore, contain only ASCII letters, digits and underscores, and
 * must not exceed 32 characters.  The default {@link org.scharp.stataxml.StataVariableNameSanitizer} rewrites the
 * survey's field codes to follow these rules.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * This library checks its input strictly and throws clear exceptions as soon as possible (fail-fast).  The exception
 * is a column that the survey doesn't know, which is dropped from the export with a warning.  A date/time value that
 * can't be read aborts the export with a {@link org.scharp.stataxml.MalformedTimestampException} before anything is
 * written.
 * </p>
 */
package org.scharp.stataxml;
