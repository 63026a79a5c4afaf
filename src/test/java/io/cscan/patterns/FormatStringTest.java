package io.cscan.patterns;

import io.cscan.patterns.FormatString.Conversion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormatStringTest {

    @Test
    void printfConversions_skipsPercentLiteral() {
        List<Conversion> conversions = FormatString.printfConversions("%d%% of %s\\n");

        assertThat(conversions).extracting(Conversion::conversion).containsExactly("d", "s");
        assertThat(FormatString.argumentCount(conversions)).isEqualTo(2);
    }

    @Test
    void printfConversions_starWidthConsumesArgument() {
        List<Conversion> conversions = FormatString.printfConversions("%*.*f");

        assertThat(FormatString.argumentCount(conversions)).isEqualTo(3);
    }

    @Test
    void printfConversions_lengthModifiers() {
        List<Conversion> conversions = FormatString.printfConversions("%lu %lld %hhx %zu");

        assertThat(conversions).extracting(Conversion::conversion).containsExactly("u", "d", "x", "u");
    }

    @Test
    void scanfConversions_suppressedAssignmentTakesNoArgument() {
        List<Conversion> conversions = FormatString.scanfConversions("%d %*d %s");

        assertThat(conversions).hasSize(3);
        assertThat(FormatString.argumentCount(conversions)).isEqualTo(2);
    }

    @Test
    void scanfConversions_scanset() {
        List<Conversion> conversions = FormatString.scanfConversions("%[^\\n]");

        assertThat(conversions).extracting(Conversion::conversion).containsExactly("[");
    }

    @Test
    void literalContents_concatenatesAdjacentLiterals() {
        assertThat(FormatString.literalContents("\"%d \" \"%d\"")).isEqualTo("%d %d");
    }

    @Test
    void literalContents_nonLiteralIsNull() {
        assertThat(FormatString.literalContents("fmt")).isNull();
        assertThat(FormatString.literalContents("\"%d\" + 1")).isNull();
    }
}
