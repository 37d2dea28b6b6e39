package org.contextql.engine.execution;

import org.contextql.engine.plan.Advisory;
import org.contextql.engine.plan.CompiledPlan;

import java.util.List;

/**
 * Outcome of executing a query against a context.
 *
 * @param plan       The compiled plan
 * @param rows       Formatted result rows
 * @param cached     Whether the rows came from the result cache
 * @param latencyMs  Wall time of the call
 * @param advisories Warning and info rules that apply to the query
 */
public record ExecutionResponse(CompiledPlan plan, BufferedResult rows, boolean cached, long latencyMs,
                                List<Advisory> advisories) {

    public ExecutionResponse {
        advisories = List.copyOf(advisories);
    }
}
