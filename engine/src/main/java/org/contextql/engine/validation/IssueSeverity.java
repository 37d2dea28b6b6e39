package org.contextql.engine.validation;

public enum IssueSeverity {
    ERROR,
    WARNING
}
