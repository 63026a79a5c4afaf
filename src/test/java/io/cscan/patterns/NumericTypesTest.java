package io.cscan.patterns;

import io.cscan.model.TypeRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumericTypesTest {

    @Test
    void rangeOf_narrowTypes() {
        assertThat(NumericTypes.rangeOf("char")).contains(new TypeRange("char", -128, 127));
        assertThat(NumericTypes.rangeOf("unsigned char")).hasValueSatisfying(r -> assertThat(r.max()).isEqualTo(255));
        assertThat(NumericTypes.rangeOf("short")).hasValueSatisfying(r -> assertThat(r.min()).isEqualTo(-32768));
    }

    @Test
    void rangeOf_normalizesSpelling() {
        assertThat(NumericTypes.rangeOf("short int")).hasValueSatisfying(r -> assertThat(r.typeName()).isEqualTo("short"));
        assertThat(NumericTypes.rangeOf("const unsigned char"))
                .hasValueSatisfying(r -> assertThat(r.typeName()).isEqualTo("unsigned char"));
    }

    @Test
    void rangeOf_wideTypesAreUnchecked() {
        assertThat(NumericTypes.rangeOf("int")).isEmpty();
        assertThat(NumericTypes.rangeOf("long")).isEmpty();
        assertThat(NumericTypes.rangeOf("unsigned int")).isEmpty();
        assertThat(NumericTypes.rangeOf(null)).isEmpty();
    }

    @Test
    void isFloating() {
        assertThat(NumericTypes.isFloating("double")).isTrue();
        assertThat(NumericTypes.isFloating("const float")).isTrue();
        assertThat(NumericTypes.isFloating("long double")).isTrue();
        assertThat(NumericTypes.isFloating("int")).isFalse();
    }
}
