package com.example.videoenhance.ai.providers.gemini;

import com.example.videoenhance.ai.core.AIModelType;
import com.example.videoenhance.ai.core.MalformedResponseException;
import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.ai.providers.CritiqueProvider;
import com.example.videoenhance.ai.providers.CritiqueResponseAdapter;
import com.example.videoenhance.ai.providers.EditedImage;
import com.example.videoenhance.ai.providers.ImageEnhancementProvider;
import com.example.videoenhance.ai.providers.PromptLibrary;
import com.example.videoenhance.ai.providers.ProviderErrors;
import com.example.videoenhance.media.FrameCodec;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.Frame;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini REST client for frame enhancement (image model, TEXT+IMAGE output)
 * and frame critique (text model, TEXT output).
 */
@Service
@ConditionalOnProperty(name = "enhancement.providers.gemini.enabled", havingValue = "true")
public class GeminiImageProvider implements ImageEnhancementProvider, CritiqueProvider {

    private static final Logger log = LoggerFactory.getLogger(GeminiImageProvider.class);

    @Value("${enhancement.providers.gemini.endpoint:https://generativelanguage.googleapis.com/v1beta}")
    private String endpoint;

    @Value("${enhancement.providers.gemini.api-key:}")
    private String apiKey;

    @Value("${enhancement.providers.gemini.image-model:gemini-3-pro-image-preview}")
    private String imageModel;

    @Value("${enhancement.providers.gemini.analysis-model:gemini-3-pro-preview}")
    private String analysisModel;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CritiqueResponseAdapter critiqueAdapter;
    private final PromptLibrary prompts;

    public GeminiImageProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                               CritiqueResponseAdapter critiqueAdapter, PromptLibrary prompts) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.critiqueAdapter = critiqueAdapter;
        this.prompts = prompts;
    }

    @Override
    public EditedImage enhance(Frame frame, String instruction) {
        long startTime = System.currentTimeMillis();
        JsonNode response = generateContent(imageModel, frame, instruction, List.of("TEXT", "IMAGE"));

        byte[] imageData = null;
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts(response)) {
            JsonNode inline = part.path("inlineData");
            if (inline.hasNonNull("data")) {
                try {
                    imageData = Base64.getDecoder().decode(inline.get("data").asText());
                } catch (IllegalArgumentException e) {
                    throw new MalformedResponseException(getProviderName(), "image data is not valid base64", e);
                }
            }
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        if (imageData == null) {
            throw new MalformedResponseException(getProviderName(), "no image in response (text: "
                + ProviderErrors.truncate(text.toString()) + ")");
        }

        Frame edited;
        try {
            edited = FrameCodec.decode(imageData, frame.getIndex(), frame.getTimestampSeconds());
        } catch (IOException e) {
            throw new MalformedResponseException(getProviderName(), "returned image cannot be decoded", e);
        }

        log.info("Gemini enhanced frame {} ({}x{} -> {}x{}) in {}ms", frame.getIndex(), frame.getWidth(),
                 frame.getHeight(), edited.getWidth(), edited.getHeight(), System.currentTimeMillis() - startTime);
        return new EditedImage(edited, text.toString().trim());
    }

    @Override
    public Critique critique(Frame frame) {
        JsonNode response = generateContent(analysisModel, frame, prompts.analysisPrompt(), List.of("TEXT"));
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts(response)) {
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        return critiqueAdapter.adapt(getProviderName(), text.toString());
    }

    // =========================
    // AIModelProvider Interface
    // =========================

    @Override
    public AIModelType getModelType() {
        return AIModelType.IMAGE_ENHANCEMENT;
    }

    @Override
    public String getProviderName() {
        return "Gemini-" + imageModel;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    // =========================
    // Private Methods
    // =========================

    private JsonNode generateContent(String model, Frame frame, String prompt, List<String> modalities) {
        if (!isAvailable()) {
            throw new ServiceCallException(getProviderName(), "API key not configured");
        }

        String encoded;
        try {
            encoded = Base64.getEncoder().encodeToString(FrameCodec.encode(frame, FrameCodec.PNG));
        } catch (IOException e) {
            throw new ServiceCallException(getProviderName(), "cannot encode frame " + frame.getIndex(), e);
        }

        Map<String, Object> inlineData = new HashMap<>();
        inlineData.put("mimeType", "image/png");
        inlineData.put("data", encoded);

        Map<String, Object> content = new HashMap<>();
        content.put("role", "user");
        content.put("parts", List.of(Map.of("inlineData", inlineData), Map.of("text", prompt)));

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("contents", List.of(content));
        requestBody.put("generationConfig", Map.of("responseModalities", modalities));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        String url = endpoint + "/models/" + model + ":generateContent";
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(requestBody, headers), String.class);
        } catch (RestClientException e) {
            log.error("Gemini {} call failed: {}", model, e.getMessage());
            throw ProviderErrors.translate(getProviderName(), e);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
        } catch (IOException e) {
            throw new MalformedResponseException(getProviderName(), "response is not JSON", e);
        }
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new MalformedResponseException(getProviderName(), "empty response body");
        }
        if (body.has("error")) {
            throw new ServiceCallException(getProviderName(), "API error: " + body.path("error").path("message").asText());
        }
        return body;
    }

    private static Iterable<JsonNode> parts(JsonNode response) {
        List<JsonNode> parts = new ArrayList<>();
        for (JsonNode candidate : response.path("candidates")) {
            candidate.path("content").path("parts").forEach(parts::add);
        }
        return parts;
    }
}
