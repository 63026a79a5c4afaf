package io.cscan.detectors;

import io.cscan.detectors.LoopBody.Modification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LoopBodyTest {

    @Test
    void scan_collectsBracedBodyAcrossLines() {
        List<String> lines = List.of(
                "for (i = 0; i < 3; i++) {",
                "    sum += i;",
                "}",
                "return sum;");

        LoopBody body = LoopBody.scan(lines, 0, lines.get(0).indexOf('{'), 20);

        assertThat(body.closed()).isTrue();
        assertThat(body.text()).contains("sum += i;").doesNotContain("return");
    }

    @Test
    void scan_stopsAfterSingleStatement() {
        List<String> lines = List.of(
                "while (n > 0)",
                "    n--;",
                "puts(done);");

        LoopBody body = LoopBody.scan(lines, 0, lines.get(0).length(), 20);

        assertThat(body.closed()).isTrue();
        assertThat(body.text()).isEqualTo("\nn--;");
    }

    @Test
    void scan_emptyStatementBody() {
        List<String> lines = List.of("while (poll());");

        LoopBody body = LoopBody.scan(lines, 0, lines.get(0).lastIndexOf(';'), 20);

        assertThat(body.closed()).isTrue();
        assertThat(body.text()).isEmpty();
    }

    @Test
    void scan_bodyLongerThanLookaheadIsNotClosed() {
        List<String> lines = List.of(
                "while (1) {",
                "    a++;",
                "    b++;",
                "}");

        LoopBody body = LoopBody.scan(lines, 0, lines.get(0).indexOf('{'), 1);

        assertThat(body.closed()).isFalse();
    }

    @Test
    void hasExit_findsJumpsAndTerminatingCalls() {
        assertThat(new LoopBody("if (x) break;", true).hasExit()).isTrue();
        assertThat(new LoopBody("return -1;", true).hasExit()).isTrue();
        assertThat(new LoopBody("goto out;", true).hasExit()).isTrue();
        assertThat(new LoopBody("exit(1);", true).hasExit()).isTrue();
        assertThat(new LoopBody("abort ();", true).hasExit()).isTrue();
    }

    @Test
    void hasExit_ignoresLookalikeIdentifiers() {
        assertThat(new LoopBody("breakfast++;", true).hasExit()).isFalse();
        assertThat(new LoopBody("exit_code = 1;", true).hasExit()).isFalse();
        assertThat(new LoopBody("continue;", true).hasExit()).isFalse();
    }

    @Test
    void modificationsOf_findsAssignments() {
        assertThat(LoopBody.modificationsOf("i", "i = i + 1;"))
                .containsExactly(new Modification("=", "i + 1"));
        assertThat(LoopBody.modificationsOf("i", "total += i; i += 2;"))
                .containsExactly(new Modification("+=", "2"));
    }

    @Test
    void modificationsOf_findsIncrementsAndDecrements() {
        assertThat(LoopBody.modificationsOf("i", "--i;"))
                .containsExactly(new Modification("--", ""));
        assertThat(LoopBody.modificationsOf("i", "a[i++] = 0;"))
                .containsExactly(new Modification("++", ""));
    }

    @Test
    void modificationsOf_treatsAddressOfAsWrite() {
        assertThat(LoopBody.modificationsOf("i", "read(&i);"))
                .containsExactly(new Modification("&", ""));
    }

    @Test
    void modificationsOf_ignoresReads() {
        assertThat(LoopBody.modificationsOf("i", "if (i == 3) sum = sum + i;")).isEmpty();
        assertThat(LoopBody.modificationsOf("i", "a[i] = 1;")).isEmpty();
        assertThat(LoopBody.modificationsOf("i", "flags = x & i;")).isEmpty();
    }

    @Test
    void modificationsOf_ignoresMembersOfOtherObjects() {
        assertThat(LoopBody.modificationsOf("i", "p->i = 3; s.i = 4;")).isEmpty();
    }
}
