package com.sentinel.classifier.engine;

import lombok.Value;

import java.util.List;

/**
 * A catalog keyword in normalized form together with its token sequence.
 */
@Value
public class Keyword {

    String phrase;

    List<String> tokens;

    static Keyword of(NormalizedText text) {
        return new Keyword(text.getValue(), text.getTokens());
    }
}
