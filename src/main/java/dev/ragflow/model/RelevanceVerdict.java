package dev.ragflow.model;

/**
 * Binary outcome of grading retrieved documents against the question.
 */
public enum RelevanceVerdict {
    RELEVANT,
    NOT_RELEVANT
}
