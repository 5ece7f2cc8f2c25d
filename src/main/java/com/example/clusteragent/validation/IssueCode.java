package com.example.clusteragent.validation;

public enum IssueCode {
    // errors
    PARSE_ERROR,
    EMPTY_MANIFEST,
    MISSING_FIELD,
    UNKNOWN_FIELD,
    TYPE_MISMATCH,
    VALIDATION_FAILED,
    DRY_RUN_ERROR,

    // warnings
    MISSING_LABELS,
    MISSING_NAMESPACE
}
