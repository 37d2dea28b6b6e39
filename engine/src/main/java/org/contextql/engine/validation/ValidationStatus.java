package org.contextql.engine.validation;

public enum ValidationStatus {
    PASSED,
    WARNING,
    FAILED
}
