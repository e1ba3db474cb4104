package me.golemcore.artifactor.domain.exception;

/**
 * Raised by a stage body to signal a failure with a user-facing reason.
 */
public class StageFailedException extends ArtifactorException {

    private final String stageName;

    public StageFailedException(String stageName, String message) {
        super(message);
        this.stageName = stageName;
    }

    public StageFailedException(String stageName, String message, Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
