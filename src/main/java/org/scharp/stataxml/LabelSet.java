///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A Stata value label: a named mapping from integer codes to texts, shared by all columns of a question's scale.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class LabelSet {

    private final String name;
    private final LabelSetKey key;
    private final SortedMap<Integer, String> entries;

    LabelSet(String name, LabelSetKey key, SortedMap<Integer, String> entries) {
        assert !entries.isEmpty() : "label sets must have an entry";

        this.name = name;
        this.key = key;
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    /**
     * Gets the label set's name, which is made of a prefix, the question's identity, and the scale's identity.
     *
     * @return The name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * @return The identity of the question that owns this label set.
     */
    public int questionId() {
        return key.questionId();
    }

    /**
     * @return The identity of the scale that owns this label set.
     */
    public int scaleId() {
        return key.scaleId();
    }

    LabelSetKey key() {
        return key;
    }

    /**
     * Gets the label set's entries.
     * <p>
     * The returned map is not modifiable.
     * </p>
     *
     * @return The texts by code, in ascending order of code.  This is never {@code null} or empty.
     */
    public SortedMap<Integer, String> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return name + entries;
    }
}
