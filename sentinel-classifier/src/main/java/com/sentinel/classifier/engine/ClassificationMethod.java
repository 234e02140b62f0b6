package com.sentinel.classifier.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mechanism that produced a classification decision.
 */
public enum ClassificationMethod {

    /**
     * Whole normalized text equals a configured override phrase
     */
    OVERRIDE("override"),

    /**
     * One or more catalog keywords found as tokens in the text
     */
    TOKEN_MATCH("token_match"),

    /**
     * Text had content but no rule matched
     */
    DEFAULT_OTHER("default_other"),

    /**
     * Nothing left after normalization (empty, numeric or symbolic input)
     */
    EMPTY_NORMALIZED("empty_normalized");

    private final String tag;

    ClassificationMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
