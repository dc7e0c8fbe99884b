package com.ttennebkram.enhancer.model;

import com.ttennebkram.enhancer.processing.UnsupportedAlgorithmException;

/**
 * The enhancement variants a deployment can select.
 * The id is the value used in configuration files and processor annotations.
 */
public enum EnhancementAlgorithm {
    /** CLAHE on the Lab luminance channel followed by gamma correction. */
    CONTRAST_GAMMA("ContrastGamma"),
    /** Drago global tone-mapping operator. */
    TONE_MAP_DRAGO("ToneMapDrago");

    private final String id;

    EnhancementAlgorithm(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Look up an algorithm by its configuration id (case-sensitive).
     */
    public static EnhancementAlgorithm fromId(String id) throws UnsupportedAlgorithmException {
        if (id != null) {
            for (EnhancementAlgorithm algorithm : values()) {
                if (algorithm.id.equals(id)) {
                    return algorithm;
                }
            }
        }
        throw new UnsupportedAlgorithmException(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
