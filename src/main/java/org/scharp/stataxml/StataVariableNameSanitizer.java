///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

/**
 * The default {@link VariableNameSanitizer}.
 * <p>
 * Stata variable names must start with a letter or underscore, contain only ASCII letters, digits, and underscores,
 * and be at most 32 characters long.  This sanitizer:
 * </p>
 * <ol>
 *     <li>prefixes names that don't start with a letter with "v"</li>
 *     <li>spells out the punctuation that survey field codes commonly contain
 *     (":" becomes "_dd_", ";" becomes "_dc_", "!" becomes "_excl_")</li>
 *     <li>replaces "-", "[", and spaces with "_" and drops "]"</li>
 *     <li>replaces any other illegal character with "_"</li>
 *     <li>truncates the result to 32 characters</li>
 * </ol>
 */
public final class StataVariableNameSanitizer implements VariableNameSanitizer {

    /** The longest name that Stata allows. */
    static final int MAX_NAME_LENGTH = 32;

    @Override
    public String sanitize(String fieldCode) {
        ArgumentUtil.checkNotNull(fieldCode, "fieldCode");

        String name = fieldCode;
        if (!name.matches("^[A-Za-z].*$")) {
            name = "v" + name;
        }

        name = name.
            replace("-", "_").
            replace(":", "_dd_").
            replace(";", "_dc_").
            replace("!", "_excl_").
            replace("[", "_").
            replace("]", "").
            replace(" ", "_").
            replaceAll("[^A-Za-z0-9_]", "_");

        return name.length() <= MAX_NAME_LENGTH ? name : name.substring(0, MAX_NAME_LENGTH);
    }
}
