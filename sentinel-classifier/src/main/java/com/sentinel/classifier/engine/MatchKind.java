package com.sentinel.classifier.engine;

/**
 * Rule tier a {@link Candidate} came from.
 */
public enum MatchKind {
    OVERRIDE,
    KEYWORD
}
