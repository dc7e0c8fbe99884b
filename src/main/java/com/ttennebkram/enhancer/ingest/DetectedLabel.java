package com.ttennebkram.enhancer.ingest;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One label returned by the vision service. Confidence is kept with two decimals.
 */
public final class DetectedLabel {

    private final String name;
    private final double confidence;
    private final List<String> categories;

    public DetectedLabel(String name, double confidence, List<String> categories) {
        this.name = Objects.requireNonNull(name, "name");
        this.confidence = Math.round(confidence * 100.0) / 100.0;
        this.categories = categories == null ? Collections.emptyList() : List.copyOf(categories);
    }

    public String getName() {
        return name;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getCategories() {
        return categories;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectedLabel)) return false;
        DetectedLabel that = (DetectedLabel) o;
        return Double.compare(that.confidence, confidence) == 0
            && name.equals(that.name)
            && categories.equals(that.categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, confidence, categories);
    }

    @Override
    public String toString() {
        return name + " (" + confidence + "%)";
    }
}
