package io.github.riemr.pm.application.exception;

public class TaskCsvFormatException extends RuntimeException {

    public TaskCsvFormatException(String message) {
        super(message);
    }

    public TaskCsvFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
