package com.typepulse.processing.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorType {
    /** Wrong key where a known character was expected. */
    SUBSTITUTION("substitution"),
    /** The expected key, recorded as wrong: a same-key double press. */
    DOUBLET("doublet"),
    /** No expected character was recorded. */
    OTHER("other");

    private final String label;

    ErrorType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
