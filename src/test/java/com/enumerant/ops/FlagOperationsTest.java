package com.enumerant.ops;

import com.enumerant.core.Member;
import com.enumerant.core.ValueSet;
import com.enumerant.error.EnumerantException;
import com.enumerant.error.ErrorType;
import com.enumerant.format.Selector;
import com.enumerant.types.IntegralType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FlagOperationsTest {

    private static final List<Selector> NAMES = List.of(Selector.NAME);

    private FlagOperations<Integer> access;
    private FlagOperations<Integer> colors;

    @BeforeEach
    void setUp() {
        access = ValueSet.builder("Access", IntegralType.INT32)
                .flags()
                .member("None", 0)
                .member("Read", 1)
                .member("Write", 2)
                .member("ReadWrite", 3)
                .build()
                .flags();
        colors = ValueSet.builder("Colors", IntegralType.INT32)
                .flags()
                .member("Red", 1)
                .member("Green", 2)
                .member("Blue", 4)
                .member("UltraViolet", 8)
                .member("All", 15)
                .build()
                .flags();
    }

    @Test
    @DisplayName("Read/Write scenario: union, decomposition and direct member match")
    void testAccessScenario() throws EnumerantException {
        assertThat(access.getAllFlags()).isEqualTo(3);
        assertThat(access.getFlags(3)).containsExactly(1, 2);
        assertThat(access.formatFlags(3, ",", NAMES)).isEqualTo("ReadWrite");
        assertThat(access.formatFlags(0, ",", NAMES)).isEqualTo("None");
    }

    @Nested
    class Algebra {

        @Test
        void testPredicates() throws EnumerantException {
            assertThat(colors.hasAnyFlags(0)).isFalse();
            assertThat(colors.hasAnyFlags(5)).isTrue();
            assertThat(colors.hasAnyFlags(5, 4)).isTrue();
            assertThat(colors.hasAnyFlags(5, 2)).isFalse();
            assertThat(colors.hasAllFlags(15)).isTrue();
            assertThat(colors.hasAllFlags(7)).isFalse();
            assertThat(colors.hasAllFlags(7, 5)).isTrue();
            assertThat(colors.hasAllFlags(5, 7)).isFalse();
        }

        @Test
        void testCombinators() throws EnumerantException {
            assertThat(colors.commonFlags(5, 6)).isEqualTo(4);
            assertThat(colors.combineFlags(1, 2)).isEqualTo(3);
            assertThat(colors.combineFlags(1, 2, 4)).isEqualTo(7);
            assertThat(colors.combineFlags(List.of(8, 1))).isEqualTo(9);
            assertThat(colors.excludeFlags(7, 2)).isEqualTo(5);
            assertThat(colors.toggleFlags(5)).isEqualTo(10);
            assertThat(colors.toggleFlags(5, 1)).isEqualTo(4);
        }

        @Test
        void testIdempotence() throws EnumerantException {
            for (int v = 0; v < 16; v++) {
                assertThat(colors.combineFlags(colors.getFlags(v))).isEqualTo(v);
                assertThat(colors.combineFlags(v, v)).isEqualTo(v);
                assertThat(colors.commonFlags(v, v)).isEqualTo(v);
                assertThat(colors.toggleFlags(colors.toggleFlags(v))).isEqualTo(v);
            }
        }

        @Test
        void testCounts() throws EnumerantException {
            assertThat(colors.getFlagCount()).isEqualTo(4);
            assertThat(colors.getFlagCount(7)).isEqualTo(3);
            assertThat(colors.getFlagMembers(5)).extracting(Member::getName).containsExactly("Red", "Blue");
        }

        @ParameterizedTest
        @ValueSource(ints = {16, 32, -1, 17})
        void testBitsOutsideUnionRejected(int invalid) {
            assertThat(colors.isValidFlagCombination(invalid)).isFalse();
            assertThatThrownBy(() -> colors.hasAnyFlags(invalid))
                    .isInstanceOf(EnumerantException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FLAG_COMBINATION);
            assertThatThrownBy(() -> colors.combineFlags(List.of(1, invalid)))
                    .isInstanceOf(EnumerantException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FLAG_COMBINATION);
            assertThatThrownBy(() -> colors.getFlags(invalid))
                    .isInstanceOf(EnumerantException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FLAG_COMBINATION);
            assertThatThrownBy(() -> colors.excludeFlags(1, invalid))
                    .isInstanceOf(EnumerantException.class);
        }
    }

    @Nested
    class Decomposition {

        @Test
        void testGetFlagsIsRestartable() throws EnumerantException {
            var flags = colors.getFlags(13);

            assertThat(flags).containsExactly(1, 4, 8);
            assertThat(flags).containsExactly(1, 4, 8);
            assertThat(colors.getFlags(0)).isEmpty();
        }

        @Test
        void testSignBitFlag() throws EnumerantException {
            var signed = ValueSet.builder("Signed", IntegralType.INT8)
                    .flags()
                    .member("Low", 1)
                    .member("Sign", -128)
                    .build()
                    .flags();

            assertThat(signed.getAllFlags()).isEqualTo((byte) -127);
            assertThat(signed.getFlags((byte) -127)).containsExactly((byte) 1, (byte) -128);
            assertThat(signed.formatFlags((byte) -127)).isEqualTo("Low, Sign");
        }
    }

    @Nested
    class Text {

        @Test
        void testFormatDecomposes() throws EnumerantException {
            assertThat(colors.formatFlags(5)).isEqualTo("Red, Blue");
            assertThat(colors.formatFlags(5, " | ", NAMES)).isEqualTo("Red | Blue");
            assertThat(colors.formatFlags(15)).isEqualTo("All");
            assertThat(colors.formatFlags(0)).isEqualTo("0");
            assertThat(colors.formatFlags(6, ",", List.of(Selector.DECIMAL))).isEqualTo("2,4");
        }

        @Test
        void testFormatFallsBackToDecimalPerFlag() throws EnumerantException {
            assertThat(colors.formatFlags(3, ", ", List.of(Selector.DESCRIPTION))).isEqualTo("1, 2");
        }

        @Test
        void testFormatRejectsInvalidCombination() {
            assertThatThrownBy(() -> colors.formatFlags(16))
                    .isInstanceOf(EnumerantException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FLAG_COMBINATION);
        }

        @Test
        void testRoundTripEveryCombination() throws EnumerantException {
            for (int v = 0; v < 16; v++) {
                var text = colors.formatFlags(v, ",", NAMES);
                assertThat(colors.parseFlags(text, false, ",", NAMES)).as(text).isEqualTo(v);
            }
            for (int v = 0; v < 4; v++) {
                var text = access.formatFlags(v, ",", NAMES);
                assertThat(access.parseFlags(text, false, ",", NAMES)).as(text).isEqualTo(v);
            }
        }

        @Test
        void testParseDelimiters() throws EnumerantException {
            assertThat(colors.parseFlags("Red, Blue", false)).isEqualTo(5);
            assertThat(colors.parseFlags("Red,Blue", false)).isEqualTo(5);
            assertThat(colors.parseFlags("  red ,  BLUE ", true)).isEqualTo(5);
            assertThat(colors.parseFlags("Red | Green", false, " | ", NAMES)).isEqualTo(3);
            assertThat(colors.parseFlags("Red Green", false, " ", NAMES)).isEqualTo(3);
            assertThat(colors.parseFlags("Red, 4", false)).isEqualTo(5);
            assertThat(colors.parseFlags("12", false)).isEqualTo(12);
            assertThat(colors.parseFlags("Red,", false)).isEqualTo(1);
        }

        @Test
        void testBlankParsesToZero() throws EnumerantException {
            assertThat(colors.parseFlags("", false)).isEqualTo(0);
            assertThat(colors.parseFlags("   ", false)).isEqualTo(0);
        }

        @Test
        void testParseFailuresNameTheToken() {
            assertThatThrownBy(() -> colors.parseFlags("Red, Purple", false))
                    .isInstanceOf(EnumerantException.class)
                    .hasMessageContaining("Purple")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.PARSE_FAILURE);
            assertThatThrownBy(() -> colors.parseFlags("Red, 16", false))
                    .isInstanceOf(EnumerantException.class)
                    .hasMessageContaining("16")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FLAG_COMBINATION);
            assertThatThrownBy(() -> colors.parseFlags("Red, 99999999999", false))
                    .isInstanceOf(EnumerantException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.OUT_OF_RANGE);
            assertThatThrownBy(() -> colors.parseFlags("Red,,Blue", false))
                    .isInstanceOf(EnumerantException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.PARSE_FAILURE);
        }

        @Test
        void testTryParseFlags() {
            assertThat(colors.tryParseFlags("Green, Blue", false, null, NAMES)).contains(6);
            assertThat(colors.tryParseFlags("Green, Pink", false, null, NAMES)).isEmpty();
            assertThat(colors.tryParseFlags(null, false, null, NAMES)).isEmpty();
        }
    }
}
