package com.cypher.bridge.bulk;

import java.util.List;

/**
 * Result of loading one or more statement files.
 *
 * @param filesProcessed     sources that were read successfully
 * @param statementsExecuted statements submitted for execution, failed ones included
 * @param statementsFailed   statements whose outcome was a failure
 * @param rowsReturned       rows returned by all successful statements
 * @param errors             unreadable sources and failed statements, in order
 */
public record FileLoadResult(
        int filesProcessed,
        int statementsExecuted,
        int statementsFailed,
        long rowsReturned,
        List<LoadError> errors
) {
    public FileLoadResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int statementsSucceeded() {
        return statementsExecuted - statementsFailed;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A source that could not be read, or a statement that failed.
     *
     * @param source          file path or reader label
     * @param statementNumber 1-based position of the statement in its source; 0 when the source was unreadable
     * @param statement       the failing statement, or null for an unreadable source
     * @param message         single-line error message
     */
    public record LoadError(String source, int statementNumber, String statement, String message) {}

    @Override
    public String toString() {
        return "FileLoadResult{files=" + filesProcessed +
                ", executed=" + statementsExecuted +
                ", failed=" + statementsFailed +
                ", rows=" + rowsReturned +
                ", errors=" + errors.size() + '}';
    }
}
