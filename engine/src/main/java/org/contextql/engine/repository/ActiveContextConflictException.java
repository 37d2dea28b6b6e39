package org.contextql.engine.repository;

/**
 * Thrown when activating a version would give an external dataset a second
 * active context.
 */
public class ActiveContextConflictException extends RuntimeException {

    private final String externalDatasetId;
    private final String activeContextId;
    private final String activeVersion;

    public ActiveContextConflictException(String externalDatasetId, String activeContextId, String activeVersion) {
        super("Dataset '" + externalDatasetId + "' already has active context '" + activeContextId
                + "' v" + activeVersion);
        this.externalDatasetId = externalDatasetId;
        this.activeContextId = activeContextId;
        this.activeVersion = activeVersion;
    }

    public String getExternalDatasetId() {
        return externalDatasetId;
    }

    public String getActiveContextId() {
        return activeContextId;
    }

    public String getActiveVersion() {
        return activeVersion;
    }
}
