package org.scharp.stataxml;

import java.util.Objects;

/** The identity of a label set: a question and one of its answer scales. */
final class LabelSetKey {

    private final int questionId;
    private final int scaleId;

    LabelSetKey(int questionId, int scaleId) {
        this.questionId = questionId;
        this.scaleId = scaleId;
    }

    static LabelSetKey of(Column column) {
        return new LabelSetKey(column.questionId(), column.scaleId());
    }

    int questionId() {
        return questionId;
    }

    int scaleId() {
        return scaleId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(questionId, scaleId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LabelSetKey otherKey)) {
            return false;
        }
        return questionId == otherKey.questionId && scaleId == otherKey.scaleId;
    }

    @Override
    public String toString() {
        return "question " + questionId + " scale " + scaleId;
    }
}
