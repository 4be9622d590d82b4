package uz.sonic.continuum.exception;

public class InvalidTaskLinkException extends RuntimeException {

    public InvalidTaskLinkException(Long taskId, Long projectId) {
        super("Task " + taskId + " does not belong to project " + projectId);
    }
}
