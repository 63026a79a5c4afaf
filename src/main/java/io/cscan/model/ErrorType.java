package io.cscan.model;

/**
 * Fixed taxonomy of reported problems, each owned by one analysis module.
 */
public enum ErrorType {
    MEMORY_LEAK("Memory-Leak", Module.MEMORY_SAFETY, Severity.WARNING),
    NULL_POINTER_DEREFERENCE("Null-Pointer-Dereference", Module.MEMORY_SAFETY, Severity.ERROR),
    WILD_POINTER_DEREFERENCE("Wild-Pointer-Dereference", Module.MEMORY_SAFETY, Severity.ERROR),
    DOUBLE_FREE("Double-Free", Module.MEMORY_SAFETY, Severity.ERROR),
    RETURN_LOCAL_ADDRESS("Return-Local-Address", Module.MEMORY_SAFETY, Severity.ERROR),

    UNINITIALIZED_VARIABLE("Uninitialized-Variable", Module.UNINITIALIZED_VARIABLE, Severity.WARNING),

    MISSING_HEADER("Missing-Header", Module.STANDARD_LIBRARY, Severity.ERROR),
    SCANF_MISSING_ADDRESS_OF("Scanf-Missing-Address-Of", Module.STANDARD_LIBRARY, Severity.ERROR),
    HEADER_MISSPELLING("Header-Misspelling", Module.STANDARD_LIBRARY, Severity.ERROR),
    PRINTF_ARGUMENT_MISMATCH("Printf-Argument-Mismatch", Module.STANDARD_LIBRARY, Severity.WARNING),

    TYPE_OVERFLOW("Type-Overflow", Module.NUMERIC_CONTROL_FLOW, Severity.WARNING),
    INFINITE_LOOP("Infinite-Loop", Module.NUMERIC_CONTROL_FLOW, Severity.WARNING),
    FLOAT_LOOP_PRECISION("Float-Loop-Precision", Module.NUMERIC_CONTROL_FLOW, Severity.WARNING);

    /**
     * Analysis modules, named as they appear in reports.
     */
    public enum Module {
        MEMORY_SAFETY("Memory-Safety"),
        UNINITIALIZED_VARIABLE("Uninitialized-Variable"),
        STANDARD_LIBRARY("Standard-Library-Usage"),
        NUMERIC_CONTROL_FLOW("Numeric-&-Control-Flow");

        private final String displayName;

        Module(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    private final String label;
    private final Module module;
    private final Severity defaultSeverity;

    ErrorType(String label, Module module, Severity defaultSeverity) {
        this.label = label;
        this.module = module;
        this.defaultSeverity = defaultSeverity;
    }

    public String label() {
        return label;
    }

    public Module module() {
        return module;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
