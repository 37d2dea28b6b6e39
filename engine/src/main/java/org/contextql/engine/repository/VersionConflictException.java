package org.contextql.engine.repository;

/**
 * Thrown when a save would overwrite an existing version of a context.
 */
public class VersionConflictException extends RuntimeException {

    private final String contextId;
    private final String version;

    public VersionConflictException(String contextId, String version) {
        super("Context '" + contextId + "' already has a version " + version);
        this.contextId = contextId;
        this.version = version;
    }

    public String getContextId() {
        return contextId;
    }

    public String getVersion() {
        return version;
    }
}
