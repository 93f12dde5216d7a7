package com.example.paybill.application.exception;

import com.example.paybill.domain.model.DocumentFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when not a single document of a batch could be parsed. This is the only failure that aborts a batch.
 */
public class NoConsumableDocumentException extends UseCaseValidationException {

    private final List<DocumentFailure> failures;

    public NoConsumableDocumentException(List<DocumentFailure> failures) {
        super(buildMessage(failures));
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public List<DocumentFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(List<DocumentFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            return "No paybill documents were supplied.";
        }
        return "None of the paybill documents could be parsed: " + failures.stream()
                .map(failure -> failure.fileName() + " (" + failure.reason() + ")")
                .collect(Collectors.joining("; "));
    }
}
