package org.contextql.engine.repository;

/**
 * Thrown when a context (or a specific version of it) does not exist or is not
 * visible to the caller.
 */
public class ContextNotFoundException extends RuntimeException {

    private final String contextId;
    private final String version;

    public ContextNotFoundException(String contextId) {
        this(contextId, null, "Context not found: " + contextId);
    }

    public ContextNotFoundException(String contextId, String version) {
        this(contextId, version, "Context not found: " + contextId + " v" + version);
    }

    private ContextNotFoundException(String contextId, String version, String message) {
        super(message);
        this.contextId = contextId;
        this.version = version;
    }

    public static ContextNotFoundException noActiveVersion(String contextId) {
        return new ContextNotFoundException(contextId, null, "Context has no active version: " + contextId);
    }

    public String getContextId() {
        return contextId;
    }

    /**
     * @return The requested version, or null when any version was requested
     */
    public String getVersion() {
        return version;
    }
}
