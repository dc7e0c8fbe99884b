package com.ttennebkram.enhancer.processing;

/**
 * The image is wider or taller than the configured maximum dimension.
 */
public class ImageTooLargeException extends EnhancementException {

    private final int width;
    private final int height;
    private final int maxDimension;

    public ImageTooLargeException(int width, int height, int maxDimension) {
        super(String.format("Image %dx%d exceeds maximum dimension %d", width, height, maxDimension));
        this.width = width;
        this.height = height;
        this.maxDimension = maxDimension;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getMaxDimension() { return maxDimension; }
}
