///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import org.apache.commons.text.StringEscapeUtils;

import java.util.regex.Pattern;

/**
 * The default {@link LabelTextCleaner}.
 * <p>
 * It removes HTML comments and tags (including the contents of {@code script} and {@code style} elements), decodes
 * HTML 4 character references, collapses runs of whitespace (including line breaks and non-breaking spaces) into a
 * single space, and trims the result.
 * </p>
 */
public final class MarkupStrippingCleaner implements LabelTextCleaner {

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile(
        "<(script|style)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    @Override
    public String clean(String text) {
        ArgumentUtil.checkNotNull(text, "text");

        // Tags are removed before decoding so that "&lt;b&gt;" stays as text.
        String stripped = SCRIPT_OR_STYLE.matcher(text).replaceAll(" ");
        stripped = COMMENT.matcher(stripped).replaceAll(" ");
        stripped = TAG.matcher(stripped).replaceAll(" ");
        stripped = StringEscapeUtils.unescapeHtml4(stripped);
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
