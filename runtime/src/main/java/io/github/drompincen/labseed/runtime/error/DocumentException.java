package io.github.drompincen.labseed.runtime.error;

import java.util.List;

/**
 * The seed document could not be read or failed validation. Raised before any remote call.
 */
public class DocumentException extends SeedException {

    private final List<String> problems;

    public DocumentException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public DocumentException(List<String> problems) {
        super("Invalid seed document: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
