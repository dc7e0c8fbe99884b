package com.ttennebkram.enhancer.ingest;

/**
 * Where the enhanced copy of an upload was stored.
 */
public final class EnhancedImage {

    private final String fileName;
    private final String bucket;
    private final String url;
    private final String processedAt;

    public EnhancedImage(String fileName, String bucket, String url, String processedAt) {
        this.fileName = fileName;
        this.bucket = bucket;
        this.url = url;
        this.processedAt = processedAt;
    }

    public String getFileName() { return fileName; }
    public String getBucket() { return bucket; }
    public String getUrl() { return url; }
    public String getProcessedAt() { return processedAt; }
}
