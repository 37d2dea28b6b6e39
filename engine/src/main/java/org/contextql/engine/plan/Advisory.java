package org.contextql.engine.plan;

import org.contextql.model.Severity;

/**
 * A warning or info business rule that applies to a query. It is not enforced,
 * only returned with the results.
 */
public record Advisory(String ruleId, Severity severity, String name, String condition, String description) {
}
