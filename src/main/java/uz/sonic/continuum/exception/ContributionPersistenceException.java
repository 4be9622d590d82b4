package uz.sonic.continuum.exception;

public class ContributionPersistenceException extends RuntimeException {

    public ContributionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
