package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.util.MatTracker;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Local contrast + gamma processor for landscape photos.
 * Applies CLAHE to the L channel of the Lab image, converts back to BGR and then
 * brightens mid-tones and shadows with a power-law lookup table.
 */
@EnhancementProcessorInfo(
    algorithm = "ContrastGamma",
    displayName = "Contrast + Gamma",
    description = "CLAHE on Lab luminance, then gamma correction\nImgproc.createCLAHE(clipLimit, tileSize) + Core.LUT(src, gammaTable, dst)"
)
public class ContrastGammaProcessor extends EnhancementProcessorBase {

    // Properties with defaults
    private double clipLimit = 2.0;
    private int tileSize = 8;
    private double gamma = 0.8;
    private int jpegQuality = 95;

    private byte[] gammaTable = buildGammaTable(gamma);

    @Override
    public String getAlgorithmId() {
        return "ContrastGamma";
    }

    @Override
    public String getDescription() {
        return "CLAHE (clip " + clipLimit + ", " + tileSize + "x" + tileSize + " tiles) on Lab luminance, gamma " + gamma;
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            throw new IllegalArgumentException("ContrastGamma expects a non-empty 8-bit BGR image");
        }

        CLAHE clahe = Imgproc.createCLAHE(clipLimit, new Size(tileSize, tileSize));

        // Track all temporary Mats for cleanup
        Mat lab = MatTracker.create();
        Mat lChannel = MatTracker.create();
        Mat contrasted = MatTracker.create();
        Mat lut = MatTracker.track(new Mat(1, 256, CvType.CV_8UC1));
        Mat output = MatTracker.create();
        List<Mat> labChannels = new ArrayList<>();
        boolean completed = false;

        try {
            Imgproc.cvtColor(input, lab, Imgproc.COLOR_BGR2Lab);
            Core.split(lab, labChannels);
            labChannels.forEach(MatTracker::track);

            // Apply CLAHE to L channel only
            clahe.apply(labChannels.get(0), lChannel);
            Core.merge(Arrays.asList(lChannel, labChannels.get(1), labChannels.get(2)), lab);
            Imgproc.cvtColor(lab, contrasted, Imgproc.COLOR_Lab2BGR);

            // Gamma on every channel
            lut.put(0, 0, gammaTable);
            Core.LUT(contrasted, lut, output);
            completed = true;
            return output;
        } finally {
            MatTracker.release(lab);
            MatTracker.release(lChannel);
            MatTracker.release(contrasted);
            MatTracker.release(lut);
            for (Mat m : labChannels) MatTracker.release(m);
            if (!completed) {
                MatTracker.release(output);
            }
        }
    }

    @Override
    public int[] getEncodeParams() {
        return new int[] {Imgcodecs.IMWRITE_JPEG_QUALITY, jpegQuality};
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("clipLimit", clipLimit);
        json.addProperty("tileSize", tileSize);
        json.addProperty("gamma", gamma);
        json.addProperty("jpegQuality", jpegQuality);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        double newClipLimit = getJsonDouble(json, "clipLimit", 2.0);
        int newTileSize = getJsonInt(json, "tileSize", 8);
        double newGamma = getJsonDouble(json, "gamma", 0.8);
        int newQuality = getJsonInt(json, "jpegQuality", 95);

        if (newClipLimit <= 0) {
            throw new IllegalArgumentException("clipLimit must be positive: " + newClipLimit);
        }
        if (newTileSize < 1) {
            throw new IllegalArgumentException("tileSize must be at least 1: " + newTileSize);
        }
        if (!(newGamma > 0) || Double.isInfinite(newGamma)) {
            throw new IllegalArgumentException("gamma must be a positive number: " + newGamma);
        }
        if (newQuality < 0 || newQuality > 100) {
            throw new IllegalArgumentException("jpegQuality must be within 0..100: " + newQuality);
        }

        clipLimit = newClipLimit;
        tileSize = newTileSize;
        gamma = newGamma;
        jpegQuality = newQuality;
        gammaTable = buildGammaTable(gamma);
    }

    /**
     * round(255 * (i / 255)^gamma) for every 8-bit value, clipped to [0, 255].
     */
    static byte[] buildGammaTable(double gamma) {
        byte[] table = new byte[256];
        for (int i = 0; i < 256; i++) {
            long v = Math.round(Math.pow(i / 255.0, gamma) * 255.0);
            table[i] = (byte) Math.max(0, Math.min(255, v));
        }
        return table;
    }

    public double getClipLimit() { return clipLimit; }
    public int getTileSize() { return tileSize; }
    public double getGamma() { return gamma; }
    public int getJpegQuality() { return jpegQuality; }
}
