package com.sentinel.classifier.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Canonical form of a description: lowercase tokens joined by single spaces.
 * Use {@link #EMPTY} to represent input that carried no matchable content.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizedText {

    public static final NormalizedText EMPTY = new NormalizedText("", List.of());

    String value;

    List<String> tokens;

    static NormalizedText of(List<String> tokens) {
        if (tokens.isEmpty()) {
            return EMPTY;
        }
        return new NormalizedText(String.join(" ", tokens), List.copyOf(tokens));
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
