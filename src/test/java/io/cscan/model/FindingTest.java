package io.cscan.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingTest {

    @Test
    void builder_fillsDefaultsFromErrorType() {
        Finding finding = Finding.builder()
                .lineNumber(4)
                .errorType(ErrorType.DOUBLE_FREE)
                .message("Double free: 'p' was already freed on line 3")
                .build();

        assertThat(finding.severity()).isEqualTo(Severity.ERROR);
        assertThat(finding.moduleName()).isEqualTo("Memory-Safety");
        assertThat(finding.suggestion()).isEmpty();
        assertThat(finding.codeSnippet()).isEmpty();
        assertThat(finding.errorTypeLabel()).isEqualTo("Double-Free");
    }

    @Test
    void builder_trimsSnippet() {
        Finding finding = Finding.builder()
                .lineNumber(1)
                .errorType(ErrorType.MISSING_HEADER)
                .message("missing")
                .codeSnippet("\t  printf(\"x\");  ")
                .build();

        assertThat(finding.codeSnippet()).isEqualTo("printf(\"x\");");
    }

    @Test
    void builder_keepsExplicitSeverity() {
        Finding finding = Finding.builder()
                .lineNumber(1)
                .errorType(ErrorType.MEMORY_LEAK)
                .severity(Severity.INFO)
                .message("leak")
                .build();

        assertThat(finding.severity()).isEqualTo(Severity.INFO);
    }

    @Test
    void constructor_rejectsInvalidValues() {
        assertThatThrownBy(() -> Finding.builder().lineNumber(0).errorType(ErrorType.MEMORY_LEAK)
                .message("leak").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lineNumber");
        assertThatThrownBy(() -> Finding.builder().lineNumber(1).message("leak").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("errorType");
        assertThatThrownBy(() -> Finding.builder().lineNumber(1).errorType(ErrorType.MEMORY_LEAK)
                .message("  ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("message");
    }

    @Test
    void summary_isCompactOneLiner() {
        Finding finding = Finding.builder()
                .lineNumber(12)
                .errorType(ErrorType.MEMORY_LEAK)
                .message("Memory leak: memory allocated to 'buf' is never freed")
                .build();

        assertThat(finding.summary())
                .isEqualTo("12: Memory-Leak - Memory leak: memory allocated to 'buf' is never freed");
    }

    @Test
    void errorTypes_belongToTheirModules() {
        assertThat(ErrorType.UNINITIALIZED_VARIABLE.module().displayName()).isEqualTo("Uninitialized-Variable");
        assertThat(ErrorType.PRINTF_ARGUMENT_MISMATCH.module().displayName()).isEqualTo("Standard-Library-Usage");
        assertThat(ErrorType.FLOAT_LOOP_PRECISION.module().displayName()).isEqualTo("Numeric-&-Control-Flow");
        assertThat(ErrorType.HEADER_MISSPELLING.defaultSeverity()).isEqualTo(Severity.ERROR);
        assertThat(ErrorType.TYPE_OVERFLOW.defaultSeverity()).isEqualTo(Severity.WARNING);
    }
}
