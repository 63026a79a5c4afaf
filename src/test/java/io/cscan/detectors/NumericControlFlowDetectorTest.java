package io.cscan.detectors;

import io.cscan.config.CheckerConfig;
import io.cscan.engine.CAnalyzer;
import io.cscan.model.ErrorType;
import io.cscan.model.Finding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NumericControlFlowDetectorTest {

    private CAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CAnalyzer(CheckerConfig.loadDefault(),
                DetectorRegistry.of(new NumericControlFlowDetector()));
    }

    @Test
    void id_returnsNumericControlFlow() {
        assertThat(new NumericControlFlowDetector().id()).isEqualTo("numeric-control-flow");
    }

    // --- type overflow ---

    @Test
    void inspect_flagsCharOverflow() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    char c = 300;
                    return c;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).errorType()).isEqualTo(ErrorType.TYPE_OVERFLOW);
        assertThat(findings.get(0).lineNumber()).isEqualTo(2);
        assertThat(findings.get(0).message()).contains("300").contains("-128 to 127");
    }

    @Test
    void inspect_flagsOverflowingAssignment() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    unsigned char u;
                    u = 256;
                    return u;
                }
                """);

        assertThat(findings).extracting(Finding::errorType).containsExactly(ErrorType.TYPE_OVERFLOW);
        assertThat(findings.get(0).lineNumber()).isEqualTo(3);
    }

    @Test
    void inspect_valuesWithinRangeAreFine() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    short low = -32768;
                    unsigned char max = 0xFF;
                    char letter = 'z';
                    int big = 300000;
                    return 0;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_flagsShortOverflow() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    short s = 40000;
                    return s;
                }
                """);

        assertThat(findings).extracting(Finding::errorType).containsExactly(ErrorType.TYPE_OVERFLOW);
    }

    // --- infinite loops ---

    @Test
    void inspect_flagsWhileTrueWithoutExit() {
        List<Finding> findings = analyzer.analyze("""
                #include <stdio.h>
                int main(void) {
                    while (1) { printf("x"); }
                    return 0;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).errorType()).isEqualTo(ErrorType.INFINITE_LOOP);
        assertThat(findings.get(0).lineNumber()).isEqualTo(3);
    }

    @Test
    void inspect_flagsSelfAssignedLoopVariable() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    int i = 0;
                    while (i < 10) {
                        i = i;
                    }
                    return 0;
                }
                """);

        assertThat(findings).extracting(Finding::errorType).containsExactly(ErrorType.INFINITE_LOOP);
        assertThat(findings.get(0).lineNumber()).isEqualTo(3);
        assertThat(findings.get(0).message()).contains("'i' is only assigned to itself");
    }

    @Test
    void inspect_flagsSelfAssignedParameterLoop() {
        List<Finding> findings = analyzer.analyze("""
                void spin(int n) {
                    while (n > 0) {
                        n = n;
                    }
                }
                """);

        assertThat(findings).extracting(Finding::errorType).containsExactly(ErrorType.INFINITE_LOOP);
        assertThat(findings.get(0).lineNumber()).isEqualTo(2);
    }

    @Test
    void inspect_selfAssignedLoopThatNeverStartsIsFine() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    int i = 20;
                    while (i < 10) {
                        i = i;
                    }
                    return 0;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_whileTrueWithBreakIsFine() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    int n = 0;
                    while (1) {
                        n++;
                        if (n > 10) {
                            break;
                        }
                    }
                    return n;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_flagsEmptyForHeader() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (;;) {
                        ;
                    }
                }
                """);

        assertThat(findings).extracting(Finding::lineNumber).containsExactly(2);
    }

    @Test
    void inspect_countingLoopTerminates() {
        List<Finding> findings = analyzer.analyze("""
                #include <stdio.h>
                int main(void) {
                    for (int i = 0; i < 10; i++) { printf("%d", i); }
                    for (int j = 10; j > 0; j -= 2) {
                        printf("%d", j);
                    }
                    return 0;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_flagsStepAwayFromBound() {
        List<Finding> findings = analyzer.analyze("""
                #include <stdio.h>
                int main(void) {
                    for (int i = 0; i < 10; i--) {
                        printf("%d\\n", i);
                    }
                    return 0;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).lineNumber()).isEqualTo(3);
        assertThat(findings.get(0).message()).startsWith("Infinite loop:").contains("decreases");
    }

    @Test
    void inspect_flagsInequalityTargetSkippedByStep() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (int i = 0; i != 9; i += 2) {
                    }
                    return 0;
                }
                """);

        assertThat(findings).extracting(Finding::errorType).containsExactly(ErrorType.INFINITE_LOOP);
    }

    @Test
    void inspect_flagsBoundOutsideTypeRange() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (unsigned char c = 0; c < 256; c++) {
                    }
                    return 0;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).message()).contains("unsigned char");
    }

    @Test
    void inspect_flagsVariableThatNeverChanges() {
        List<Finding> findings = analyzer.analyze("""
                #include <stdio.h>
                int main(void) {
                    int i = 0;
                    while (i < 10) {
                        printf("%d\\n", i);
                    }
                    return 0;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).lineNumber()).isEqualTo(4);
        assertThat(findings.get(0).message()).contains("never changes");
    }

    @Test
    void inspect_whileWithUpdateInBodyTerminates() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    int i = 0;
                    while (i < 10) {
                        i = i + 1;
                    }
                    return i;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_flagsMultiplicationStuckAtZero() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (int i = 0; i < 100; i *= 2) {
                    }
                    for (int k = 1; k < 100; k *= 2) {
                    }
                    return 0;
                }
                """);

        assertThat(findings).extracting(Finding::lineNumber).containsExactly(2);
        assertThat(findings.get(0).message()).contains("stuck at 0");
    }

    @Test
    void inspect_usesMacroBound() {
        List<Finding> findings = analyzer.analyze("""
                #define MAX 10
                int main(void) {
                    for (int i = 0; i < MAX; i--) {
                    }
                    return 0;
                }
                """);

        assertThat(findings).extracting(Finding::lineNumber).containsExactly(3);
    }

    @Test
    void inspect_unknownBoundIsLeftAlone() {
        List<Finding> findings = analyzer.analyze("""
                int count(int n) {
                    int i;
                    for (i = 0; i < n; i--) {
                    }
                    return i;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_exitInBodyIsLeftAlone() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (int i = 0; i < 10; i--) {
                        if (i < -5) return 1;
                    }
                    return 0;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_flagsDoWhileThatNeverChanges() {
        List<Finding> findings = analyzer.analyze("""
                #include <stdio.h>
                int main(void) {
                    int i = 0;
                    do {
                        printf("%d\\n", i);
                    } while (i < 10);
                    return 0;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).lineNumber()).isEqualTo(6);
    }

    @Test
    void inspect_doWhileWithIncrementTerminates() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    int i = 0;
                    do {
                        i++;
                    } while (i < 10);
                    return i;
                }
                """);

        assertThat(findings).isEmpty();
    }

    @Test
    void inspect_flagsFloatCounterComparedForEquality() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (double x = 0.0; x != 1.0; x += 0.1) {
                    }
                    return 0;
                }
                """);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).errorType()).isEqualTo(ErrorType.FLOAT_LOOP_PRECISION);
    }

    @Test
    void inspect_flagsFractionalFloatStep() {
        List<Finding> findings = analyzer.analyze("""
                int main(void) {
                    for (float f = 0; f < 1; f += 0.1f) {
                    }
                    return 0;
                }
                """);

        assertThat(findings).extracting(Finding::errorType).containsExactly(ErrorType.FLOAT_LOOP_PRECISION);
    }
}
