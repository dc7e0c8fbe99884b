package com.ttennebkram.enhancer.processing;

import com.ttennebkram.enhancer.TestImages;
import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.model.EnhancementAlgorithm;
import com.ttennebkram.enhancer.util.MatTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageEnhancerTest {

    private static ImageEnhancer enhancer;

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
        enhancer = new ImageEnhancer(EnhancerConfig.defaults());
    }

    @AfterEach
    void stopTracking() {
        MatTracker.setEnabled(false);
        MatTracker.reset();
    }

    @ParameterizedTest
    @EnumSource(EnhancementAlgorithm.class)
    void keepsWidthAndHeight(EnhancementAlgorithm algorithm) throws Exception {
        byte[] input = TestImages.png(TestImages.gradient(37, 23));

        Mat output = TestImages.decode(enhancer.enhance(input, algorithm));

        assertThat(output.cols()).isEqualTo(37);
        assertThat(output.rows()).isEqualTo(23);
        assertThat(output.type()).isEqualTo(CvType.CV_8UC3);
        output.release();
    }

    @ParameterizedTest
    @EnumSource(EnhancementAlgorithm.class)
    void isDeterministic(EnhancementAlgorithm algorithm) throws Exception {
        byte[] input = TestImages.jpeg(TestImages.gradient(64, 48));

        byte[] first = enhancer.enhance(input, algorithm);
        byte[] second = enhancer.enhance(input, algorithm);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void outputIsAlwaysJpeg() throws Exception {
        byte[] input = TestImages.png(TestImages.gradient(16, 16));

        byte[] output = enhancer.enhance(input, EnhancementAlgorithm.CONTRAST_GAMMA);

        // JPEG SOI marker
        assertThat(output[0]).isEqualTo((byte) 0xFF);
        assertThat(output[1]).isEqualTo((byte) 0xD8);
    }

    @Test
    void doesNotModifyInputBuffer() throws Exception {
        byte[] input = TestImages.png(TestImages.gradient(20, 20));
        byte[] copy = Arrays.copyOf(input, input.length);

        enhancer.enhance(input, EnhancementAlgorithm.TONE_MAP_DRAGO);

        assertThat(input).isEqualTo(copy);
    }

    @Test
    void usesConfiguredDefaultAlgorithm() throws Exception {
        byte[] input = TestImages.png(TestImages.gradient(24, 24));
        ImageEnhancer contrast = new ImageEnhancer(EnhancerConfig.defaults().withAlgorithm(EnhancementAlgorithm.CONTRAST_GAMMA));

        assertThat(contrast.enhance(input)).isEqualTo(enhancer.enhance(input, EnhancementAlgorithm.CONTRAST_GAMMA));
        assertThat(enhancer.enhance(input)).isEqualTo(enhancer.enhance(input, EnhancementAlgorithm.TONE_MAP_DRAGO));
    }

    @Test
    void midGrayGetsBrighterWithContrastGamma() throws Exception {
        byte[] input = TestImages.png(TestImages.solid(4, 4, 128, 128, 128));

        Mat output = TestImages.decode(enhancer.enhance(input, EnhancementAlgorithm.CONTRAST_GAMMA));

        assertThat(output.cols()).isEqualTo(4);
        assertThat(output.rows()).isEqualTo(4);
        assertThat(TestImages.mean(output)).isGreaterThan(128.0);
        output.release();
    }

    @Test
    void allBlackImageSurvivesToneMapping() throws Exception {
        byte[] input = TestImages.png(TestImages.solid(16, 16, 0, 0, 0));

        byte[] output = enhancer.enhance(input, EnhancementAlgorithm.TONE_MAP_DRAGO);

        Mat decoded = TestImages.decode(output);
        assertThat(decoded.empty()).isFalse();
        assertThat(decoded.cols()).isEqualTo(16);
        assertThat(decoded.rows()).isEqualTo(16);
        assertThat(TestImages.mean(decoded)).isLessThan(1.0);
        decoded.release();
    }

    @Test
    void saturatedImageSurvivesToneMapping() throws Exception {
        byte[] input = TestImages.png(TestImages.solid(16, 16, 255, 255, 255));

        Mat decoded = TestImages.decode(enhancer.enhance(input, EnhancementAlgorithm.TONE_MAP_DRAGO));

        assertThat(decoded.size()).isEqualTo(new org.opencv.core.Size(16, 16));
        decoded.release();
    }

    @Test
    void grayscaleInputComesOutAsThreeChannels() throws Exception {
        Mat gray = new Mat(10, 12, CvType.CV_8UC1, new org.opencv.core.Scalar(90));
        byte[] input = TestImages.png(gray);

        Mat decoded = TestImages.decode(enhancer.enhance(input, EnhancementAlgorithm.CONTRAST_GAMMA));

        assertThat(decoded.channels()).isEqualTo(3);
        assertThat(decoded.cols()).isEqualTo(12);
        assertThat(decoded.rows()).isEqualTo(10);
        decoded.release();
    }

    @Test
    void emptyInputFailsToDecode() {
        assertThatThrownBy(() -> enhancer.enhance(new byte[0], EnhancementAlgorithm.CONTRAST_GAMMA))
            .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> enhancer.enhance(null, EnhancementAlgorithm.CONTRAST_GAMMA))
            .isInstanceOf(DecodeException.class);
    }

    @Test
    void truncatedInputFailsToDecode() {
        byte[] png = TestImages.png(TestImages.gradient(32, 32));
        byte[] truncated = Arrays.copyOf(png, 16);

        assertThatThrownBy(() -> enhancer.enhance(truncated, EnhancementAlgorithm.TONE_MAP_DRAGO))
            .isInstanceOf(DecodeException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.3, 0.5, 0.9})
    void truncatedJpegFailsToDecode(double keep) {
        byte[] jpeg = TestImages.jpeg(TestImages.gradient(256, 256));
        byte[] truncated = Arrays.copyOf(jpeg, (int) (jpeg.length * keep));

        assertThatThrownBy(() -> enhancer.enhance(truncated, EnhancementAlgorithm.TONE_MAP_DRAGO))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("end-of-image");
        assertThatThrownBy(() -> enhancer.enhance(truncated, EnhancementAlgorithm.CONTRAST_GAMMA))
            .isInstanceOf(DecodeException.class);
    }

    @Test
    void jpegWithTrailingPaddingStillDecodes() throws Exception {
        byte[] jpeg = TestImages.jpeg(TestImages.gradient(40, 30));
        byte[] padded = Arrays.copyOf(jpeg, jpeg.length + 64);

        Mat output = TestImages.decode(enhancer.enhance(padded, EnhancementAlgorithm.TONE_MAP_DRAGO));

        assertThat(output.cols()).isEqualTo(40);
        assertThat(output.rows()).isEqualTo(30);
        output.release();
    }

    @Test
    void detectsMissingEndOfImageMarker() {
        byte[] jpeg = TestImages.jpeg(TestImages.gradient(32, 32));

        assertThat(ImageEnhancer.isTruncatedJpeg(jpeg)).isFalse();
        assertThat(ImageEnhancer.isTruncatedJpeg(Arrays.copyOf(jpeg, jpeg.length - 2))).isTrue();
        assertThat(ImageEnhancer.isTruncatedJpeg(new byte[] {(byte) 0xFF, (byte) 0xD8})).isTrue();
        // Only buffers that start like a JPEG are checked
        assertThat(ImageEnhancer.isTruncatedJpeg(TestImages.png(TestImages.gradient(8, 8)))).isFalse();
    }

    @Test
    void refusesToStartWithoutEveryProcessor() {
        assertThatThrownBy(() -> ImageEnhancer.requireEveryAlgorithm(Set.of("ContrastGamma")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ToneMapDrago");

        ImageEnhancer.requireEveryAlgorithm(Set.of("ContrastGamma", "ToneMapDrago"));
    }

    @Test
    void garbageInputFailsToDecode() {
        byte[] garbage = "definitely not an image".getBytes();

        assertThatThrownBy(() -> enhancer.enhance(garbage, EnhancementAlgorithm.TONE_MAP_DRAGO))
            .isInstanceOf(DecodeException.class)
            .hasMessageContaining("not a supported image format");
    }

    @Test
    void unknownAlgorithmFailsBeforeDecoding() {
        MatTracker.setEnabled(true);
        MatTracker.reset();
        byte[] input = TestImages.png(TestImages.gradient(8, 8));

        assertThatThrownBy(() -> enhancer.enhance(input, "Sharpen"))
            .isInstanceOf(UnsupportedAlgorithmException.class)
            .hasMessageContaining("Sharpen");
        assertThat(MatTracker.getTotalCreated()).isZero();
    }

    @Test
    void rejectsImagesLargerThanMaxDimension() {
        ImageEnhancer small = new ImageEnhancer(EnhancerConfig.defaults().withMaxDimension(16));
        byte[] wide = TestImages.png(TestImages.gradient(32, 8));

        assertThatThrownBy(() -> small.enhance(wide))
            .isInstanceOfSatisfying(ImageTooLargeException.class, e -> {
                assertThat(e.getWidth()).isEqualTo(32);
                assertThat(e.getHeight()).isEqualTo(8);
                assertThat(e.getMaxDimension()).isEqualTo(16);
            });
    }

    @Test
    void probesDimensionsFromHeader() {
        byte[] png = TestImages.png(TestImages.gradient(21, 13));

        assertThat(ImageEnhancer.probeDimensions(png)).containsExactly(21, 13);
        assertThat(ImageEnhancer.probeDimensions("nope".getBytes())).isNull();
    }

    @ParameterizedTest
    @EnumSource(EnhancementAlgorithm.class)
    void releasesEveryIntermediateMat(EnhancementAlgorithm algorithm) throws Exception {
        byte[] input = TestImages.png(TestImages.gradient(40, 30));
        MatTracker.setEnabled(true);
        MatTracker.reset();

        enhancer.enhance(input, algorithm);

        assertThat(MatTracker.getTotalCreated()).isPositive();
        assertThat(MatTracker.getActiveCount()).isZero();
    }

    @Test
    void releasesDecodedMatWhenRejectingLargeImage() {
        ImageEnhancer small = new ImageEnhancer(EnhancerConfig.defaults().withMaxDimension(8));
        // ImageIO has no PPM reader, so the limit is enforced after decoding
        byte[] ppm = TestImages.encode(".ppm", TestImages.gradient(16, 16));
        MatTracker.setEnabled(true);
        MatTracker.reset();

        assertThatThrownBy(() -> small.enhance(ppm)).isInstanceOf(ImageTooLargeException.class);
        assertThat(MatTracker.getActiveCount()).isZero();
    }

    @Test
    void sharedInstanceIsSafeAcrossThreads() throws Exception {
        byte[] input = TestImages.jpeg(TestImages.gradient(48, 32));
        byte[] expected = enhancer.enhance(input, EnhancementAlgorithm.CONTRAST_GAMMA);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<byte[]>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> enhancer.enhance(input, EnhancementAlgorithm.CONTRAST_GAMMA)));
            }
            for (Future<byte[]> result : results) {
                assertThat(result.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
