package org.contextql.engine.plan;

public class UndefinedFilterException extends CompileException {

    private final String filterId;

    public UndefinedFilterException(String filterId) {
        super("Filter '" + filterId + "' is not defined in this context");
        this.filterId = filterId;
    }

    public String getFilterId() {
        return filterId;
    }
}
