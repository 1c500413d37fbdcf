package com.tsrouter.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one write request. Lines are accepted or rejected one by one;
 * accepted lines stay queued whatever happens to their neighbours.
 */
public class WriteResult {

    /**
     * Why a line was rejected.
     */
    public enum Reason {
        MALFORMED,
        NO_ROUTE,
        UNAVAILABLE
    }

    private int accepted;
    private final List<LineError> errors = new ArrayList<>();

    void accept() {
        accepted++;
    }

    void reject(int line, Reason reason, String message) {
        errors.add(new LineError(line, reason, message));
    }

    public int getAccepted() {
        return accepted;
    }

    public int getRejected() {
        return errors.size();
    }

    public List<LineError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isComplete() {
        return errors.isEmpty();
    }

    /**
     * 204 when every line was accepted, 400 when a line was malformed or unmapped,
     * 503 when lines were rejected only because their backends are down.
     */
    public int getHttpStatus() {
        if (errors.isEmpty()) {
            return 204;
        }
        boolean clientError = errors.stream().anyMatch(e -> e.getReason() != Reason.UNAVAILABLE);
        return clientError ? 400 : 503;
    }

    @Override
    public String toString() {
        return String.format("WriteResult{accepted=%d, rejected=%d}", accepted, errors.size());
    }

    public static class LineError {
        private final int line;
        private final Reason reason;
        private final String message;

        public LineError(int line, Reason reason, String message) {
            this.line = line;
            this.reason = reason;
            this.message = message;
        }

        /**
         * 1-based line number in the request body.
         */
        public int getLine() { return line; }
        public Reason getReason() { return reason; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("line %d: %s (%s)", line, message, reason);
        }
    }
}
