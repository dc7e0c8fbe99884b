package com.ttennebkram.enhancer.processing;

import com.ttennebkram.enhancer.config.EnhancerConfig;
import com.ttennebkram.enhancer.model.EnhancementAlgorithm;
import com.ttennebkram.enhancer.processors.EnhancementProcessor;
import com.ttennebkram.enhancer.processors.EnhancementProcessorRegistry;
import com.ttennebkram.enhancer.util.MatTracker;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes a compressed image, applies one enhancement algorithm and re-encodes the result as JPEG.
 *
 * Processors are created and configured once, in the constructor, and never modified afterwards,
 * so a single instance can be shared by concurrent callers. Every intermediate Mat is local to
 * one call and released before the call returns.
 *
 * The OpenCV native library must be loaded before the first call
 * (see {@code nu.pattern.OpenCV.loadLocally()}).
 */
public class ImageEnhancer {

    private static final Logger LOG = Logger.getLogger(ImageEnhancer.class.getName());

    private static final String OUTPUT_EXTENSION = ".jpg";

    private final EnhancerConfig config;
    private final Map<String, EnhancementProcessor> processors;

    /**
     * @throws IllegalArgumentException when a processor block in the configuration has invalid values
     * @throws IllegalStateException when classpath scanning did not find a processor for every algorithm
     */
    public ImageEnhancer(EnhancerConfig config) {
        this.config = config;

        Set<String> registered = EnhancementProcessorRegistry.getRegisteredAlgorithms();
        requireEveryAlgorithm(registered);

        Map<String, EnhancementProcessor> configured = new LinkedHashMap<>();
        for (String algorithmId : registered) {
            try {
                configured.put(algorithmId, EnhancementProcessorRegistry.createProcessor(
                    algorithmId, config.getProcessorProperties(algorithmId)));
            } catch (UnsupportedAlgorithmException e) {
                // Registered ids always resolve
                throw new IllegalStateException(e);
            }
        }
        this.processors = Collections.unmodifiableMap(configured);
    }

    static void requireEveryAlgorithm(Set<String> registered) {
        List<String> missing = new ArrayList<>();
        for (EnhancementAlgorithm algorithm : EnhancementAlgorithm.values()) {
            if (!registered.contains(algorithm.getId())) {
                missing.add(algorithm.getId());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No enhancement processor registered for " + missing
                + " (found " + registered + ")");
        }
    }

    public EnhancerConfig getConfig() {
        return config;
    }

    /**
     * Enhance with the configured default algorithm.
     */
    public byte[] enhance(byte[] input) throws EnhancementException {
        return enhance(input, config.getAlgorithm());
    }

    public byte[] enhance(byte[] input, EnhancementAlgorithm algorithm) throws EnhancementException {
        return enhance(input, algorithm.getId());
    }

    /**
     * Enhance an image buffer.
     *
     * @param input compressed image bytes; read only
     * @param algorithmId id of a registered algorithm
     * @return JPEG bytes of the enhanced image, same width and height as the input
     * @throws UnsupportedAlgorithmException before any decoding when the id is unknown
     * @throws ImageTooLargeException when either side exceeds the configured maximum
     * @throws DecodeException when the bytes are not a decodable image
     * @throws EncodeException when the result cannot be written as JPEG
     */
    public byte[] enhance(byte[] input, String algorithmId) throws EnhancementException {
        EnhancementProcessor processor = getProcessor(algorithmId);
        long start = System.nanoTime();

        Mat decoded = decode(input);
        Mat enhanced = null;
        try {
            try {
                enhanced = processor.createImageProcessor().process(decoded);
            } catch (CvException | IllegalArgumentException e) {
                throw new EnhancementException(processor.getAlgorithmId() + " failed: " + e.getMessage(), e);
            }
            checkShape(decoded, enhanced);
            byte[] output = encode(enhanced, processor.getEncodeParams());

            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("%s enhanced %dx%d image (%d -> %d bytes) in %.1f ms",
                    processor.getAlgorithmId(), decoded.cols(), decoded.rows(), input.length, output.length,
                    (System.nanoTime() - start) / 1_000_000.0));
            }
            return output;
        } finally {
            MatTracker.release(decoded);
            MatTracker.release(enhanced);
        }
    }

    /**
     * Resolve a configured processor.
     */
    public EnhancementProcessor getProcessor(String algorithmId) throws UnsupportedAlgorithmException {
        EnhancementProcessor processor = algorithmId == null ? null : processors.get(algorithmId);
        if (processor == null) {
            throw new UnsupportedAlgorithmException(algorithmId);
        }
        return processor;
    }

    /**
     * Decode to an 8-bit, 3-channel BGR Mat. The caller releases the result.
     */
    Mat decode(byte[] input) throws DecodeException, ImageTooLargeException {
        if (input == null || input.length == 0) {
            throw new DecodeException("Image buffer is empty");
        }
        // libjpeg fills the missing rows of a cut-off stream instead of failing
        if (isTruncatedJpeg(input)) {
            throw new DecodeException("JPEG data ends before the end-of-image marker (" + input.length + " bytes)");
        }

        // Reject oversized images from the header before allocating pixels
        int[] declared = probeDimensions(input);
        if (declared != null) {
            checkDimensions(declared[0], declared[1]);
        }

        MatOfByte buffer = new MatOfByte(input);
        Mat decoded;
        try {
            decoded = MatTracker.track(Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR));
        } catch (CvException e) {
            throw new DecodeException("Failed to decode image: " + e.getMessage(), e);
        } finally {
            buffer.release();
        }

        if (decoded == null || decoded.empty() || decoded.rows() <= 0 || decoded.cols() <= 0) {
            MatTracker.release(decoded);
            throw new DecodeException("Image buffer is not a supported image format (" + input.length + " bytes)");
        }
        if (decoded.type() != CvType.CV_8UC3) {
            String type = CvType.typeToString(decoded.type());
            MatTracker.release(decoded);
            throw new DecodeException("Unexpected decoded pixel type " + type);
        }
        try {
            checkDimensions(decoded.cols(), decoded.rows());
        } catch (ImageTooLargeException e) {
            MatTracker.release(decoded);
            throw e;
        }
        return decoded;
    }

    /**
     * Encode an 8-bit BGR Mat as JPEG.
     */
    byte[] encode(Mat image, int[] params) throws EncodeException {
        MatOfByte buffer = new MatOfByte();
        MatOfInt flags = new MatOfInt(params);
        try {
            if (!Imgcodecs.imencode(OUTPUT_EXTENSION, image, buffer, flags)) {
                throw new EncodeException("JPEG encoder rejected " + image.cols() + "x" + image.rows() + " image");
            }
            byte[] bytes = buffer.toArray();
            if (bytes.length == 0) {
                throw new EncodeException("JPEG encoder produced no data");
            }
            return bytes;
        } catch (CvException e) {
            throw new EncodeException("Failed to encode image: " + e.getMessage(), e);
        } finally {
            buffer.release();
            flags.release();
        }
    }

    private void checkShape(Mat input, Mat output) throws EncodeException {
        if (output == null || output.empty()) {
            throw new EncodeException("Enhancement produced an empty image");
        }
        if (output.rows() != input.rows() || output.cols() != input.cols() || output.type() != CvType.CV_8UC3) {
            throw new EncodeException(String.format("Enhanced image is %dx%d %s, expected %dx%d CV_8UC3",
                output.cols(), output.rows(), CvType.typeToString(output.type()), input.cols(), input.rows()));
        }
    }

    private void checkDimensions(int width, int height) throws ImageTooLargeException {
        int max = config.getMaxDimension();
        if (width > max || height > max) {
            throw new ImageTooLargeException(width, height, max);
        }
    }

    /**
     * True for a buffer that starts like a JPEG but has no EOI marker after its last scan header.
     * Bytes after the EOI marker are ignored. Markers cannot occur inside entropy-coded data,
     * and an EOI before the last SOS belongs to an embedded thumbnail.
     */
    static boolean isTruncatedJpeg(byte[] input) {
        if (input.length < 2 || (input[0] & 0xFF) != 0xFF || (input[1] & 0xFF) != 0xD8) {
            return false;
        }
        int lastScan = -1;
        int lastEnd = -1;
        for (int i = 2; i + 1 < input.length; i++) {
            if ((input[i] & 0xFF) != 0xFF) {
                continue;
            }
            int marker = input[i + 1] & 0xFF;
            if (marker == 0xDA) {
                lastScan = i;
            } else if (marker == 0xD9) {
                lastEnd = i;
            }
        }
        return lastEnd < 0 || lastEnd < lastScan;
    }

    /**
     * Read width and height from the image header with an ImageIO reader.
     * Returns null when ImageIO has no reader for the format or cannot parse the header;
     * OpenCV then decides whether the bytes are an image.
     */
    static int[] probeDimensions(byte[] input) {
        try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(input))) {
            if (stream == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(stream, true, true);
                return new int[] {reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.FINE, "Header probe failed, deferring to decoder", e);
            return null;
        }
    }
}
