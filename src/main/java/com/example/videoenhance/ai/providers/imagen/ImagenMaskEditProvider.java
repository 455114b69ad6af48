package com.example.videoenhance.ai.providers.imagen;

import com.example.videoenhance.ai.core.AIModelType;
import com.example.videoenhance.ai.core.MalformedResponseException;
import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.ai.providers.ProviderErrors;
import com.example.videoenhance.ai.providers.SurgicalEditProvider;
import com.example.videoenhance.media.FrameCodec;
import com.example.videoenhance.model.Frame;
import com.example.videoenhance.util.VertexCredentials;
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
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Imagen mask-based inpainting through the Vertex AI predict endpoint. Used for
 * surgical fixes confined to one region of a representative frame.
 */
@Service
@ConditionalOnProperty(name = "enhancement.providers.imagen.enabled", havingValue = "true")
public class ImagenMaskEditProvider implements SurgicalEditProvider {

    private static final Logger log = LoggerFactory.getLogger(ImagenMaskEditProvider.class);

    @Value("${enhancement.providers.imagen.project-id:}")
    private String projectId;

    @Value("${enhancement.providers.imagen.location:us-central1}")
    private String location;

    @Value("${enhancement.providers.imagen.model:imagen-3.0-capability-001}")
    private String modelName;

    @Value("${enhancement.providers.imagen.edit-mode:inpainting-remove}")
    private String editMode;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RegionMaskGenerator maskGenerator;
    private final VertexCredentials credentials;

    public ImagenMaskEditProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                                  RegionMaskGenerator maskGenerator, VertexCredentials credentials) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.maskGenerator = maskGenerator;
        this.credentials = credentials;
    }

    @Override
    public Frame edit(Frame frame, String region, String instruction) {
        if (!isAvailable()) {
            throw new ServiceCallException(getProviderName(), "Vertex AI project or credentials not configured");
        }
        long startTime = System.currentTimeMillis();

        String image;
        String mask;
        String token;
        try {
            token = credentials.getAccessToken();
        } catch (IOException e) {
            throw new ServiceCallException(getProviderName(), "cannot obtain Vertex AI access token", e);
        }
        try {
            image = Base64.getEncoder().encodeToString(FrameCodec.encode(frame, FrameCodec.PNG));
            mask = Base64.getEncoder().encodeToString(
                maskGenerator.generatePng(frame.getWidth(), frame.getHeight(), region));
        } catch (IOException e) {
            throw new ServiceCallException(getProviderName(), "cannot encode frame or mask", e);
        }

        Map<String, Object> instance = new HashMap<>();
        instance.put("prompt", instruction);
        instance.put("image", Map.of("bytesBase64Encoded", image));
        // MASK_MODE_FOREGROUND: white mask pixels are the ones edited
        instance.put("mask", Map.of("image", Map.of("bytesBase64Encoded", mask), "maskMode", "MASK_MODE_FOREGROUND"));

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("instances", List.of(instance));
        requestBody.put("parameters", Map.of("sampleCount", 1, "editMode", editMode));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(token);

        String url = String.format(
            "https://%s-aiplatform.googleapis.com/v1/projects/%s/locations/%s/publishers/google/models/%s:predict",
            location, projectId, location, modelName);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(requestBody, headers), String.class);
        } catch (RestClientException e) {
            log.error("Imagen edit of region '{}' failed: {}", region, e.getMessage());
            throw ProviderErrors.translate(getProviderName(), e);
        }

        JsonNode prediction;
        try {
            JsonNode body = objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
            prediction = body == null ? null : body.path("predictions").path(0);
        } catch (IOException e) {
            throw new MalformedResponseException(getProviderName(), "response is not JSON", e);
        }
        if (prediction == null || !prediction.hasNonNull("bytesBase64Encoded")) {
            throw new MalformedResponseException(getProviderName(), "no prediction returned");
        }

        Frame edited;
        try {
            byte[] data = Base64.getDecoder().decode(prediction.get("bytesBase64Encoded").asText());
            edited = FrameCodec.decode(data, frame.getIndex(), frame.getTimestampSeconds());
        } catch (IllegalArgumentException | IOException e) {
            throw new MalformedResponseException(getProviderName(), "returned image cannot be decoded", e);
        }

        log.info("Imagen edited region '{}' of frame {} in {}ms", region, frame.getIndex(),
                 System.currentTimeMillis() - startTime);
        return edited;
    }

    @Override
    public AIModelType getModelType() {
        return AIModelType.MASK_EDIT;
    }

    @Override
    public String getProviderName() {
        return "Imagen-" + modelName;
    }

    @Override
    public boolean isAvailable() {
        return projectId != null && !projectId.isBlank() && credentials.isConfigured();
    }
}
