package org.contextql.engine.plan;

/**
 * Thrown when a named filter's parameter has neither a request value nor a default.
 */
public class MissingParameterException extends CompileException {

    private final String filterId;
    private final String parameter;

    public MissingParameterException(String filterId, String parameter) {
        super("Filter '" + filterId + "' needs a value for parameter '" + parameter + "'");
        this.filterId = filterId;
        this.parameter = parameter;
    }

    public String getFilterId() {
        return filterId;
    }

    public String getParameter() {
        return parameter;
    }
}
