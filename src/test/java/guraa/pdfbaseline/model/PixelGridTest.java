package guraa.pdfbaseline.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PixelGridTest {

    @Test
    void ofCopiesTheSampleBuffer() {
        byte[] samples = {1, 2, 3, 4};
        PixelGrid grid = PixelGrid.of(2, 2, PixelGrid.GRAY, samples);

        samples[0] = 99;

        assertThat(grid.get(0, 0, 0)).isEqualTo(1);
        assertThat(grid.get(1, 1, 0)).isEqualTo(4);
    }

    @Test
    void samplesAreUnsigned() {
        PixelGrid grid = PixelGrid.filled(1, 1, PixelGrid.RGB, 255);

        assertThat(grid.get(0, 0, 2)).isEqualTo(255);
    }

    @Test
    void rejectsBufferOfWrongLength() {
        assertThatThrownBy(() -> PixelGrid.of(2, 2, PixelGrid.RGB, new byte[4]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnsupportedChannelCount() {
        assertThatThrownBy(() -> PixelGrid.filled(2, 2, 4, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("channel");
    }

    @Test
    void comparableOnlyWhenAllDimensionsMatch() {
        PixelGrid rgb = PixelGrid.filled(4, 5, PixelGrid.RGB, 0);

        assertThat(rgb.isComparableTo(PixelGrid.filled(4, 5, PixelGrid.RGB, 200))).isTrue();
        assertThat(rgb.isComparableTo(PixelGrid.filled(5, 4, PixelGrid.RGB, 0))).isFalse();
        assertThat(rgb.isComparableTo(PixelGrid.filled(4, 5, PixelGrid.GRAY, 0))).isFalse();
        assertThat(rgb.isComparableTo(null)).isFalse();
    }

    @Test
    void builderClampsAndLeavesSourceUntouched() {
        PixelGrid source = PixelGrid.filled(2, 2, PixelGrid.GRAY, 100);

        PixelGrid derived = source.toBuilder()
                .set(0, 0, 0, 300)
                .set(1, 1, 0, -5)
                .build();

        assertThat(derived.get(0, 0, 0)).isEqualTo(255);
        assertThat(derived.get(1, 1, 0)).isEqualTo(0);
        assertThat(source.get(0, 0, 0)).isEqualTo(100);
    }

    @Test
    void builderCanOnlyBuildOnce() {
        PixelGrid.Builder builder = PixelGrid.builder(1, 1, PixelGrid.GRAY);
        builder.build();

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void equalityIsByContent() {
        PixelGrid a = PixelGrid.filled(3, 3, PixelGrid.RGB, 7);
        PixelGrid b = PixelGrid.filled(3, 3, PixelGrid.RGB, 7);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(PixelGrid.filled(3, 3, PixelGrid.RGB, 8));
    }
}
