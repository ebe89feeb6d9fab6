package org.mapextract.text;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mapextract.api.MapFormatException;
import org.mapextract.api.MapFormatException.Reason;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class IntegerArrayScannerTest {

    @Test
    void testParsesTokensInOrder() throws Exception {
        assertThat(IntegerArrayScanner.scan(TextSpan.of("1 2 3"))).containsExactly(1L, 2L, 3L);
    }

    @Test
    void testKeepsDuplicatesAndSpansLines() throws Exception {
        assertThat(IntegerArrayScanner.scan(TextSpan.of("\n\t30 10\n 30\r\n007 ")))
                .containsExactly(30L, 10L, 30L, 7L);
    }

    @Test
    void testEmptyInputYieldsEmptyList() throws Exception {
        assertThat(IntegerArrayScanner.scan(TextSpan.of(""))).isEmpty();
        assertThat(IntegerArrayScanner.scan(TextSpan.of("  \n "))).isEmpty();
    }

    @Test
    void testFullUnsignedRange() throws Exception {
        assertThat(IntegerArrayScanner.scan(TextSpan.of("0 4294967295")))
                .containsExactly(0L, IntegerArrayScanner.MAX_UNSIGNED_INT);
    }

    @Test
    void testInvalidTokenIsIdentified() {
        assertThatThrownBy(() -> IntegerArrayScanner.scan(TextSpan.of("1 2x 3")))
                .isInstanceOfSatisfying(MapFormatException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(Reason.INVALID_INTEGER);
                    assertThat(e.getToken()).isEqualTo("2x");
                    assertThat(e.getMessage()).contains("'2x'");
                });
    }

    @Test
    void testOverflowIsRejected() {
        assertThatThrownBy(() -> IntegerArrayScanner.scan(TextSpan.of("4294967296")))
                .isInstanceOfSatisfying(MapFormatException.class,
                        e -> assertThat(e.getToken()).isEqualTo("4294967296"));
        assertThatThrownBy(() -> IntegerArrayScanner.scan(TextSpan.of("99999999999999999999999")))
                .isInstanceOf(MapFormatException.class);
    }

    @Test
    void testSignsAreRejected() {
        assertThatThrownBy(() -> IntegerArrayScanner.scan(TextSpan.of("-1")))
                .isInstanceOf(MapFormatException.class);
        assertThatThrownBy(() -> IntegerArrayScanner.scan(TextSpan.of("+1")))
                .isInstanceOf(MapFormatException.class);
    }

    @Test
    void testErrorLineIsRelativeToSource() {
        TextSpan span = TextSpan.of("provinces = {\n 1 2\n 3 x\n}").subSequence(13, 23);

        assertThatThrownBy(() -> IntegerArrayScanner.scan(span))
                .isInstanceOfSatisfying(MapFormatException.class, e -> assertThat(e.getLine()).isEqualTo(3));
    }
}
