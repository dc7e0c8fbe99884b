package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.util.MatTracker;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.photo.Photo;
import org.opencv.photo.TonemapDrago;

/**
 * Drago tone-mapping processor.
 * Compresses the dynamic range of the whole frame with a logarithmic operator, which suits
 * scenes with a bright sky over a darker foreground.
 */
@EnhancementProcessorInfo(
    algorithm = "ToneMapDrago",
    displayName = "Drago Tone Map",
    description = "Drago global tone mapping\nPhoto.createTonemapDrago(gamma, saturation, bias).process(src, dst)"
)
public class ToneMapDragoProcessor extends EnhancementProcessorBase {

    // Properties with defaults
    private double gamma = 1.0;
    private double saturation = 0.7;
    private double bias = 0.85;

    @Override
    public String getAlgorithmId() {
        return "ToneMapDrago";
    }

    @Override
    public String getDescription() {
        return "Drago tone mapping (gamma " + gamma + ", saturation " + saturation + ", bias " + bias + ")";
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            throw new IllegalArgumentException("ToneMapDrago expects a non-empty 8-bit BGR image");
        }

        Mat normalized = MatTracker.create();
        Mat mapped = MatTracker.create();
        Mat output = MatTracker.create();
        boolean completed = false;

        try {
            // Convert to float32 in [0, 1]
            input.convertTo(normalized, CvType.CV_32FC3, 1.0 / 255.0);

            if (hasPositiveValue(normalized)) {
                TonemapDrago drago = Photo.createTonemapDrago((float) gamma, (float) saturation, (float) bias);
                drago.process(normalized, mapped);
            } else {
                // All-black frame: the operator divides by a zero mean luminance
                normalized.copyTo(mapped);
            }

            sanitize(mapped);

            mapped.convertTo(output, CvType.CV_8UC3, 255.0);
            completed = true;
            return output;
        } finally {
            MatTracker.release(normalized);
            MatTracker.release(mapped);
            if (!completed) {
                MatTracker.release(output);
            }
        }
    }

    /**
     * Replace NaN with 0.0, positive infinity with 1.0 and negative infinity with 0.0, in place.
     * Finite values are clipped to [0, 1] as well.
     *
     * @param floatMat CV_32F matrix with any number of channels
     */
    public static void sanitize(Mat floatMat) {
        if (floatMat.depth() != CvType.CV_32F) {
            throw new IllegalArgumentException("sanitize expects a CV_32F matrix, got " + CvType.typeToString(floatMat.type()));
        }
        Core.patchNaNs(floatMat, 0.0);
        Core.min(floatMat, Scalar.all(1.0), floatMat);
        Core.max(floatMat, Scalar.all(0.0), floatMat);
    }

    private static boolean hasPositiveValue(Mat floatMat) {
        Mat flat = floatMat.reshape(1);
        try {
            return Core.minMaxLoc(flat).maxVal > 0.0;
        } finally {
            flat.release();
        }
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("gamma", gamma);
        json.addProperty("saturation", saturation);
        json.addProperty("bias", bias);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        double newGamma = getJsonDouble(json, "gamma", 1.0);
        double newSaturation = getJsonDouble(json, "saturation", 0.7);
        double newBias = getJsonDouble(json, "bias", 0.85);

        if (!(newGamma > 0) || Double.isInfinite(newGamma)) {
            throw new IllegalArgumentException("gamma must be a positive number: " + newGamma);
        }
        if (!(newSaturation >= 0) || Double.isInfinite(newSaturation)) {
            throw new IllegalArgumentException("saturation must be non-negative: " + newSaturation);
        }
        if (!(newBias > 0) || newBias > 1.0) {
            throw new IllegalArgumentException("bias must be within (0, 1]: " + newBias);
        }

        gamma = newGamma;
        saturation = newSaturation;
        bias = newBias;
    }

    public double getGamma() { return gamma; }
    public double getSaturation() { return saturation; }
    public double getBias() { return bias; }
}
