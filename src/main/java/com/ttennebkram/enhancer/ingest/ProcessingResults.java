package com.ttennebkram.enhancer.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results accumulated while one upload moves through the chain.
 * Stage failures are appended to the error list instead of aborting the request.
 */
public final class ProcessingResults {

    private final String fileName;
    private final String processedAt;
    private final String status = "processed";
    private String url;
    private List<DetectedLabel> labels = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private String caption;
    private EnhancedImage enhanced;
    private ProcessingSummary summary;

    ProcessingResults(String fileName, String processedAt) {
        this.fileName = fileName;
        this.processedAt = processedAt;
    }

    void setUrl(String url) {
        this.url = url;
    }

    void setLabels(List<DetectedLabel> labels) {
        this.labels = new ArrayList<>(labels);
    }

    void addError(String error) {
        errors.add(error);
    }

    void setCaption(String caption) {
        this.caption = caption;
    }

    void setEnhanced(EnhancedImage enhanced) {
        this.enhanced = enhanced;
    }

    void setSummary(ProcessingSummary summary) {
        this.summary = summary;
    }

    public String getFileName() { return fileName; }
    public String getProcessedAt() { return processedAt; }
    public String getStatus() { return status; }
    public String getUrl() { return url; }
    public List<DetectedLabel> getLabels() { return Collections.unmodifiableList(labels); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public String getCaption() { return caption; }
    public EnhancedImage getEnhanced() { return enhanced; }
    public ProcessingSummary getSummary() { return summary; }
}
