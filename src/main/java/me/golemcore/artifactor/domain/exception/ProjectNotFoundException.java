package me.golemcore.artifactor.domain.exception;

public class ProjectNotFoundException extends ArtifactorException {

    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
    }
}
