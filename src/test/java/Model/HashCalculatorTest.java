package Model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashCalculatorTest {

    @TempDir
    Path dir;

    private final HashCalculator calculator = new HashCalculator(new DetectionConfig(16, 4, 30, 4, 1));

    @Test
    void should_ProduceComponentsOfConfiguredLength() throws Exception {
        Path file = TestImages.write(TestImages.ramp(160, 120), dir, "poster.png");

        Fingerprint fp = calculator.compute(file);

        assertThat(fp.hashSize()).isEqualTo(16);
        assertThat(fp.algorithmVersion()).isEqualTo(Fingerprint.ALGORITHM_VERSION);
        assertThat(fp.perceptualBits()).hasSize(256);
        assertThat(fp.averageBits()).hasSize(64);
        assertThat(fp.gradientBits()).hasSize(64);
    }

    @Test
    void should_ReturnSameFingerprint_When_SameBytesHashedTwice() throws Exception {
        Path file = TestImages.write(TestImages.withNoise(TestImages.ramp(200, 150), 20, 7L), dir, "noisy.png");

        assertThat(calculator.compute(file)).isEqualTo(calculator.compute(file));
    }

    @Test
    void should_SetPerceptualBit_Only_When_LeftPixelIsBrighter() {
        Fingerprint rising = calculator.compute(TestImages.ramp(170, 160));
        Fingerprint falling = calculator.compute(TestImages.mirroredRamp(170, 160));

        assertThat(ones(rising.perceptualBits())).isLessThanOrEqualTo(16L);
        assertThat(ones(falling.perceptualBits())).isGreaterThanOrEqualTo(240L);
    }

    @Test
    void should_SetAverageBitsAboveMean() {
        Fingerprint rising = calculator.compute(TestImages.ramp(160, 160));

        String average = rising.averageBits();
        // top-left cell is the darkest, bottom-right the brightest
        assertThat(average.charAt(0)).isEqualTo('0');
        assertThat(average.charAt(63)).isEqualTo('1');
        assertThat(ones(average)).isBetween(16L, 48L);
    }

    @Test
    void should_SetGradientBits_When_ImageBrightensDownwards() {
        Fingerprint rising = calculator.compute(TestImages.ramp(160, 160));
        Fingerprint falling = calculator.compute(TestImages.mirroredRamp(160, 160));

        assertThat(ones(rising.gradientBits())).isGreaterThanOrEqualTo(56L);
        assertThat(ones(falling.gradientBits())).isLessThanOrEqualTo(8L);
    }

    @Test
    void should_HashTinyImages_By_Upsampling() {
        BufferedImage tiny = TestImages.ramp(3, 2);

        Fingerprint fp = calculator.compute(tiny);

        assertThat(fp.perceptualBits()).hasSize(256);
    }

    @Test
    void should_Fail_When_FileIsEmpty() throws Exception {
        Path empty = Files.createFile(dir.resolve("empty.jpg"));

        assertThatThrownBy(() -> calculator.compute(empty))
                .isInstanceOf(FingerprintException.class)
                .hasMessageContaining("empty.jpg");
        assertThat(calculator.tryCompute(empty)).isEmpty();
    }

    @Test
    void should_Fail_When_FileIsNotAnImage() throws Exception {
        Path text = Files.writeString(dir.resolve("caption.png"), "not really a png");

        assertThatThrownBy(() -> calculator.compute(text)).isInstanceOf(FingerprintException.class);
    }

    @Test
    void should_Fail_When_FileIsMissing() {
        assertThat(calculator.tryCompute(dir.resolve("missing.png"))).isEmpty();
    }

    private static long ones(String bits) {
        return bits.chars().filter(c -> c == '1').count();
    }
}
