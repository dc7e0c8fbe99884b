package com.ttennebkram.enhancer.ingest;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Upload request: base64 image data, the client's file name and an optional MIME type.
 */
public final class IngestRequest {

    public static final String DEFAULT_FILE_TYPE = "image/jpeg";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String image;
    private final String fileName;
    private final String fileType;

    public IngestRequest(String image, String fileName, String fileType) {
        this.image = image;
        this.fileName = fileName;
        this.fileType = fileType == null || fileType.isBlank() ? DEFAULT_FILE_TYPE : fileType;
    }

    /**
     * Parse a JSON body of the form {"image": ..., "fileName": ..., "fileType": ...}.
     * Missing fields become null; they are validated by the service.
     *
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public static IngestRequest fromJson(String body) {
        JsonObject json;
        try {
            JsonElement root = JsonParser.parseString(body == null ? "" : body);
            if (!root.isJsonObject()) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            json = root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Request body is not valid JSON: " + e.getMessage(), e);
        }
        return new IngestRequest(getString(json, "image"), getString(json, "fileName"), getString(json, "fileType"));
    }

    private static String getString(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    /**
     * Decode the base64 payload. A leading data URL prefix ("data:image/png;base64,") is ignored,
     * as are line breaks.
     *
     * @throws IllegalArgumentException if the payload is not valid base64
     */
    public byte[] decodeImage() {
        String data = image;
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        return Base64.getDecoder().decode(WHITESPACE.matcher(data).replaceAll(""));
    }

    public String getImage() { return image; }
    public String getFileName() { return fileName; }
    public String getFileType() { return fileType; }
}
