package com.forecastsentinel.core.codec;

import com.forecastsentinel.core.error.DecodingException;
import com.forecastsentinel.core.model.QuantileVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link QuantileCodec}.
 */
class QuantileCodecTest {

    private static final String SAMPLE = "100|90|92|95|98|100|102|105|108|110";

    @Test
    @DisplayName("Should decode point and quantiles in order")
    void shouldDecode() {
        QuantileVector vector = QuantileCodec.decode(SAMPLE);

        assertThat(vector.point()).isEqualTo(100.0);
        assertThat(vector.get(1)).isEqualTo(90.0);
        assertThat(vector.get(9)).isEqualTo(110.0);
        assertThat(vector.isMonotonic()).isTrue();
    }

    @Test
    @DisplayName("Should ignore whitespace around segments")
    void shouldTrimSegments() {
        assertThat(QuantileCodec.decode(" 1 | 2|3|4|5|6|7|8|9| 10 "))
                .isEqualTo(QuantileVector.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));
    }

    @Test
    @DisplayName("Should write integral values without a fraction")
    void shouldEncodeCompactly() {
        assertThat(QuantileCodec.encode(QuantileCodec.decode(SAMPLE))).isEqualTo(SAMPLE);
        assertThat(QuantileCodec.encode(QuantileVector.of(0.5, 1, 2, 3, 4, 5, 6, 7, 8, 9.25)))
                .isEqualTo("0.5|1|2|3|4|5|6|7|8|9.25");
    }

    @Test
    @DisplayName("decode(encode(v)) returns v exactly")
    void shouldRoundTrip() {
        Random random = new Random(20240115L);
        for (int n = 0; n < 200; n++) {
            double[] values = new double[QuantileVector.SIZE];
            for (int i = 0; i < values.length; i++) {
                values[i] = switch (n % 4) {
                    case 0 -> random.nextGaussian() * 1e6;
                    case 1 -> Math.rint(random.nextDouble() * 1000);
                    case 2 -> random.nextDouble() * 1e-12;
                    default -> -random.nextDouble() * Double.MAX_VALUE;
                };
            }
            QuantileVector vector = QuantileVector.of(values);

            assertThat(QuantileCodec.decode(QuantileCodec.encode(vector))).isEqualTo(vector);
        }
        QuantileVector signedZero = QuantileVector.of(-0.0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        assertThat(QuantileCodec.decode(QuantileCodec.encode(signedZero))).isEqualTo(signedZero);
    }

    @Test
    @DisplayName("Should reject nine and eleven segments")
    void shouldRejectWrongSegmentCount() {
        assertThatThrownBy(() -> QuantileCodec.decode("1|2|3|4|5|6|7|8|9"))
                .isInstanceOfSatisfying(DecodingException.class, e -> {
                    assertThat(e.getSegmentCount()).isEqualTo(9);
                    assertThat(e.getRawText()).isEqualTo("1|2|3|4|5|6|7|8|9");
                });
        assertThatThrownBy(() -> QuantileCodec.decode("1|2|3|4|5|6|7|8|9|10|11"))
                .isInstanceOfSatisfying(DecodingException.class,
                        e -> assertThat(e.getSegmentCount()).isEqualTo(11));
    }

    @Test
    @DisplayName("Should reject non-numeric, empty and non-finite segments")
    void shouldRejectBadSegments() {
        assertThatThrownBy(() -> QuantileCodec.decode("1|2|x|4|5|6|7|8|9|10"))
                .isInstanceOf(DecodingException.class)
                .hasMessageContaining("Segment 2");
        assertThatThrownBy(() -> QuantileCodec.decode("1|2|3|4|5|6|7|8|9|"))
                .isInstanceOf(DecodingException.class);
        assertThatThrownBy(() -> QuantileCodec.decode("1|2|3|4|5|6|7|8|9|NaN"))
                .isInstanceOf(DecodingException.class)
                .hasMessageContaining("not finite");
        assertThatThrownBy(() -> QuantileCodec.decode("  "))
                .isInstanceOf(DecodingException.class);
    }
}
