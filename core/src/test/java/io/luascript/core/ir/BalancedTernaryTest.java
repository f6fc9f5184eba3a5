package io.luascript.core.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("BalancedTernary")
class BalancedTernaryTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"0, 0", "1, 1", "2, 1T", "3, 10", "4, 11", "5, 1TT", "13, 111", "-1, T", "-2, T1", "-4, TT"})
    @DisplayName("encodes known values")
    void encodesKnownValues(long value, String digits) {
        assertThat(BalancedTernary.encode(value)).isEqualTo(digits);
        assertThat(BalancedTernary.decode(digits)).isEqualTo(value);
    }

    @Test
    @DisplayName("decode inverts encode over a signed range")
    void roundTripsSignedRange() {
        for (long n = -2000; n <= 2000; n++) {
            assertThat(BalancedTernary.decode(BalancedTernary.encode(n))).isEqualTo(n);
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {Long.MAX_VALUE, Long.MIN_VALUE, Long.MAX_VALUE - 1, Long.MIN_VALUE + 1})
    @DisplayName("round-trips the long boundaries")
    void roundTripsBoundaries(long value) {
        String digits = BalancedTernary.encode(value);
        assertThat(BalancedTernary.isValid(digits)).isTrue();
        assertThat(BalancedTernary.decode(digits)).isEqualTo(value);
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        void emptyInput() {
            assertThatThrownBy(() -> BalancedTernary.decode(""))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must not be empty");
        }

        @Test
        void foreignDigits() {
            assertThatThrownBy(() -> BalancedTernary.decode("1T2"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'2'");
            assertThat(BalancedTernary.isValid("1T2")).isFalse();
        }

        @Test
        void valuesBeyondLong() {
            String tooLong = "1".repeat(45);
            assertThatThrownBy(() -> BalancedTernary.decode(tooLong))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("out of range");
        }
    }
}
