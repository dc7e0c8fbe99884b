package com.ttennebkram.enhancer.ingest;

public final class ProcessingSummary {

    private final int totalLabels;
    private final boolean hasErrors;
    private final boolean enhancementApplied;

    public ProcessingSummary(int totalLabels, boolean hasErrors, boolean enhancementApplied) {
        this.totalLabels = totalLabels;
        this.hasErrors = hasErrors;
        this.enhancementApplied = enhancementApplied;
    }

    public int getTotalLabels() { return totalLabels; }
    public boolean hasErrors() { return hasErrors; }
    public boolean isEnhancementApplied() { return enhancementApplied; }
}
