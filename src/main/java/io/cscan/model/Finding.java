package io.cscan.model;

/**
 * A single reported problem in a C source file.
 *
 * @param lineNumber  1-based line number in the original, unstripped source
 * @param errorType   Category of the problem
 * @param severity    Severity of the finding
 * @param message     Human-readable description of what was found
 * @param suggestion  Recommended fix
 * @param codeSnippet The offending source line, trimmed
 * @param moduleName  Name of the analysis module that reported the problem
 */
public record Finding(
        int lineNumber,
        ErrorType errorType,
        Severity severity,
        String message,
        String suggestion,
        String codeSnippet,
        String moduleName
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1, was " + lineNumber);
        }
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (severity == null) {
            severity = errorType.defaultSeverity();
        }
        if (suggestion == null) {
            suggestion = "";
        }
        if (codeSnippet == null) {
            codeSnippet = "";
        }
        if (moduleName == null || moduleName.isBlank()) {
            moduleName = errorType.module().displayName();
        }
    }

    /**
     * Builder for creating Finding instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int lineNumber;
        private ErrorType errorType;
        private Severity severity;
        private String message;
        private String suggestion;
        private String codeSnippet;
        private String moduleName;

        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder errorType(ErrorType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder codeSnippet(String codeSnippet) {
            this.codeSnippet = codeSnippet != null ? codeSnippet.trim() : null;
            return this;
        }

        public Builder moduleName(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public Finding build() {
            return new Finding(
                    lineNumber,
                    errorType,
                    severity,
                    message,
                    suggestion,
                    codeSnippet,
                    moduleName
            );
        }
    }

    /**
     * Returns the taxonomy label, e.g. "Memory-Leak".
     */
    public String errorTypeLabel() {
        return errorType.label();
    }

    /**
     * Returns a compact one-line rendering: {@code 12: Memory-Leak - message}.
     */
    public String summary() {
        return lineNumber + ": " + errorType.label() + " - " + message;
    }
}
