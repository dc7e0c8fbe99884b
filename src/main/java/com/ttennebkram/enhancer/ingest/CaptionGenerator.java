package com.ttennebkram.enhancer.ingest;

/**
 * Hosted language model that turns detected labels into a short description.
 */
public interface CaptionGenerator {

    /**
     * @return the raw text of the model's reply
     */
    String generate(CaptionRequest request) throws CaptionException;
}
