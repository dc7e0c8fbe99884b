package com.ttennebkram.enhancer.ingest;

import com.ttennebkram.enhancer.config.IngestConfig;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One call to the caption model: fixed system instruction, a user message listing the
 * detected labels and the sampling parameters.
 */
public final class CaptionRequest {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private final String modelId;
    private final String systemPrompt;
    private final String userMessage;
    private final int maxTokens;
    private final double temperature;
    private final double topP;

    public CaptionRequest(String modelId, String systemPrompt, String userMessage,
                          int maxTokens, double temperature, double topP) {
        this.modelId = modelId;
        this.systemPrompt = systemPrompt;
        this.userMessage = userMessage;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.topP = topP;
    }

    public static CaptionRequest forLabels(List<String> labelNames, IngestConfig config) {
        String message = "Describe this image, which contains the following detected labels: "
            + String.join(", ", labelNames) + ".";
        return new CaptionRequest(config.getCaptionModelId(), config.getCaptionSystemPrompt(), message,
            config.getCaptionMaxTokens(), config.getCaptionTemperature(), config.getCaptionTopP());
    }

    /**
     * The model is asked for a quoted sentence; take the first quoted segment, or the
     * whole trimmed reply when it has none. Blank replies give null.
     */
    public static String extractCaption(String modelText) {
        if (modelText == null || modelText.isBlank()) {
            return null;
        }
        Matcher m = QUOTED.matcher(modelText);
        if (m.find()) {
            return m.group(1).trim();
        }
        return modelText.trim();
    }

    public String getModelId() { return modelId; }
    public String getSystemPrompt() { return systemPrompt; }
    public String getUserMessage() { return userMessage; }
    public int getMaxTokens() { return maxTokens; }
    public double getTemperature() { return temperature; }
    public double getTopP() { return topP; }
}
