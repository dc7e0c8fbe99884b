package com.ttennebkram.enhancer.ingest;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The persisted description of one processed upload.
 * JSON names follow the table's snake_case attribute names.
 */
public final class ImageRecord {

    @SerializedName("process_id")
    private final String processId;
    @SerializedName("user_id")
    private final String userId;

    @SerializedName("file_name")
    private final String fileName;
    @SerializedName("file_type")
    private final String fileType;
    private final String url;

    @SerializedName("enhanced_file_name")
    private final String enhancedFileName;
    @SerializedName("enhanced_file_type")
    private final String enhancedFileType;
    @SerializedName("enhanced_url")
    private final String enhancedUrl;

    // Names only, for quick lookups
    private final List<String> labels;
    @SerializedName("labels_details")
    private final List<DetectedLabel> labelDetails;

    private final String description;

    private final String status;
    @SerializedName("created_at")
    private final String createdAt;
    @SerializedName("processed_at")
    private final String processedAt;

    @SerializedName("processing_summary")
    private final ProcessingSummary processingSummary;

    private ImageRecord(Builder b) {
        this.processId = Objects.requireNonNull(b.processId, "processId");
        this.userId = b.userId;
        this.fileName = b.fileName;
        this.fileType = b.fileType;
        this.url = b.url;
        this.enhancedFileName = b.enhancedFileName;
        this.enhancedFileType = b.enhancedFileType;
        this.enhancedUrl = b.enhancedUrl;
        this.labels = b.labels == null ? Collections.emptyList() : List.copyOf(b.labels);
        this.labelDetails = b.labelDetails == null ? Collections.emptyList() : List.copyOf(b.labelDetails);
        this.description = b.description;
        this.status = b.status;
        this.createdAt = b.createdAt;
        this.processedAt = b.processedAt;
        this.processingSummary = b.processingSummary;
    }

    public static Builder builder(String processId) {
        return new Builder(processId);
    }

    public String getProcessId() { return processId; }
    public String getUserId() { return userId; }
    public String getFileName() { return fileName; }
    public String getFileType() { return fileType; }
    public String getUrl() { return url; }
    public String getEnhancedFileName() { return enhancedFileName; }
    public String getEnhancedFileType() { return enhancedFileType; }
    public String getEnhancedUrl() { return enhancedUrl; }
    public List<String> getLabels() { return labels; }
    public List<DetectedLabel> getLabelDetails() { return labelDetails; }
    public String getDescription() { return description; }
    public String getStatus() { return status; }
    public String getCreatedAt() { return createdAt; }
    public String getProcessedAt() { return processedAt; }
    public ProcessingSummary getProcessingSummary() { return processingSummary; }

    public static final class Builder {
        private final String processId;
        private String userId;
        private String fileName;
        private String fileType;
        private String url;
        private String enhancedFileName;
        private String enhancedFileType;
        private String enhancedUrl;
        private List<String> labels;
        private List<DetectedLabel> labelDetails;
        private String description;
        private String status;
        private String createdAt;
        private String processedAt;
        private ProcessingSummary processingSummary;

        private Builder(String processId) {
            this.processId = processId;
        }

        public Builder userId(String v) { userId = v; return this; }
        public Builder fileName(String v) { fileName = v; return this; }
        public Builder fileType(String v) { fileType = v; return this; }
        public Builder url(String v) { url = v; return this; }
        public Builder enhancedFileName(String v) { enhancedFileName = v; return this; }
        public Builder enhancedFileType(String v) { enhancedFileType = v; return this; }
        public Builder enhancedUrl(String v) { enhancedUrl = v; return this; }
        public Builder labels(List<String> v) { labels = v; return this; }
        public Builder labelDetails(List<DetectedLabel> v) { labelDetails = v; return this; }
        public Builder description(String v) { description = v; return this; }
        public Builder status(String v) { status = v; return this; }
        public Builder createdAt(String v) { createdAt = v; return this; }
        public Builder processedAt(String v) { processedAt = v; return this; }
        public Builder processingSummary(ProcessingSummary v) { processingSummary = v; return this; }

        public ImageRecord build() {
            return new ImageRecord(this);
        }
    }
}
