package com.example.chronotrace.embedding;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedding service reached over HTTP. The endpoint accepts
 * {@code {"model", "inputType": "text"|"video", "input"}} and answers either
 * {@code {"embedding": [...]}} or {@code {"data": [{"embedding": [...]}]}}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "chronotrace.embedding.type", havingValue = "http")
public class HttpEmbeddingService implements EmbeddingService {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String apiKey;
    private final String model;
    private final int dim;

    @Autowired
    public HttpEmbeddingService(ChronoTraceProperties properties, ObjectMapper objectMapper) {
        this(new OkHttpClient.Builder()
                        .callTimeout(properties.getEmbedding().getCallTimeout())
                        .build(),
                objectMapper,
                properties.getEmbedding().getHttp().getUrl(),
                properties.getEmbedding().getHttp().getApiKey(),
                properties.getEmbedding().getHttp().getModel(),
                properties.getEmbedding().getDimension());
    }

    HttpEmbeddingService(OkHttpClient httpClient, ObjectMapper objectMapper, String url,
                         String apiKey, String model, int dimension) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("chronotrace.embedding.http.url must be set when embedding.type=http");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.url = url;
        this.apiKey = apiKey;
        this.model = model;
        this.dim = dimension;
    }

    @Override
    public float[] embedVideo(byte[] content) {
        return call("video", Base64.getEncoder().encodeToString(content));
    }

    @Override
    public float[] embedText(String text) {
        return call("text", text);
    }

    @Override
    public int dimension() {
        return dim;
    }

    private float[] call(String inputType, String input) {
        String body;
        try {
            Map<String, Object> requestMap = new LinkedHashMap<>();
            requestMap.put("model", model);
            requestMap.put("inputType", inputType);
            requestMap.put("input", input);
            body = objectMapper.writeValueAsString(requestMap);
        } catch (IOException e) {
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "cannot encode request", e);
        }

        Request.Builder request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                int code = response.code();
                log.warn("Embedding endpoint answered {} for {} input", code, inputType);
                throw new EmbeddingServiceException(classify(code), "embedding endpoint returned HTTP " + code);
            }
            return parse(responseBody);
        } catch (IOException e) {
            // timeouts and connection resets
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.TRANSIENT,
                    "embedding call failed: " + e.getMessage(), e);
        }
    }

    static EmbeddingServiceException.Kind classify(int httpStatus) {
        if (httpStatus == 408 || httpStatus == 429 || httpStatus >= 500) {
            return EmbeddingServiceException.Kind.TRANSIENT;
        }
        return EmbeddingServiceException.Kind.PERMANENT;
    }

    private float[] parse(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "unparsable embedding response", e);
        }
        JsonNode embArray = root.path("embedding");
        if (!embArray.isArray()) {
            embArray = root.path("data").path(0).path("embedding");
        }
        if (!embArray.isArray() || embArray.size() == 0) {
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "embedding response carries no vector");
        }
        float[] embedding = new float[embArray.size()];
        for (int i = 0; i < embArray.size(); i++) {
            embedding[i] = (float) embArray.get(i).asDouble();
        }
        return embedding;
    }
}
