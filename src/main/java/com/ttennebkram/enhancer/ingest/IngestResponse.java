package com.ttennebkram.enhancer.ingest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP-style response: status code, headers and a JSON body.
 */
public final class IngestResponse {

    static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

    private static final Map<String, String> CORS_HEADERS;
    private static final Map<String, String> JSON_HEADERS;

    static {
        Map<String, String> cors = new LinkedHashMap<>();
        cors.put("Access-Control-Allow-Origin", "*");
        cors.put("Access-Control-Allow-Methods", "POST, OPTIONS");
        cors.put("Access-Control-Allow-Headers", "Content-Type");
        cors.put("Content-Type", "application/json");
        CORS_HEADERS = Collections.unmodifiableMap(cors);
        JSON_HEADERS = Collections.singletonMap("Content-Type", "application/json");
    }

    private final int statusCode;
    private final Map<String, String> headers;
    private final JsonObject body;

    private IngestResponse(int statusCode, Map<String, String> headers, JsonObject body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
    }

    /** 200 with CORS headers, for browser clients. */
    public static IngestResponse ok(JsonObject body) {
        return new IngestResponse(200, CORS_HEADERS, body);
    }

    /** 200 with a plain JSON content type. */
    public static IngestResponse okJson(JsonObject body) {
        return new IngestResponse(200, JSON_HEADERS, body);
    }

    public static IngestResponse error(int statusCode, String error) {
        JsonObject body = new JsonObject();
        body.addProperty("error", error);
        return new IngestResponse(statusCode, JSON_HEADERS, body);
    }

    public static IngestResponse error(int statusCode, String error, String details) {
        JsonObject body = new JsonObject();
        body.addProperty("error", error);
        body.addProperty("details", details);
        return new IngestResponse(statusCode, JSON_HEADERS, body);
    }

    static IngestResponse withBody(int statusCode, JsonObject body) {
        return new IngestResponse(statusCode, JSON_HEADERS, body);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public JsonObject getBody() {
        return body.deepCopy();
    }

    /**
     * Envelope with the body serialized as a string, the shape API gateways expect.
     */
    public String toJson() {
        JsonObject envelope = new JsonObject();
        envelope.addProperty("statusCode", statusCode);
        envelope.add("headers", GSON.toJsonTree(headers));
        envelope.addProperty("body", GSON.toJson(body));
        return GSON.toJson(envelope);
    }

    @Override
    public String toString() {
        return statusCode + " " + GSON.toJson(body);
    }
}
