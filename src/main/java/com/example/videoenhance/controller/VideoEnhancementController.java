package com.example.videoenhance.controller;

import com.example.videoenhance.api.ApiResponse;
import com.example.videoenhance.config.EnhancementProperties;
import com.example.videoenhance.controller.dto.EnhancementRequest;
import com.example.videoenhance.pipeline.EnhancementConfig;
import com.example.videoenhance.pipeline.EnhancementEstimator;
import com.example.videoenhance.pipeline.EnhancementResult;
import com.example.videoenhance.pipeline.VideoEnhancementPipeline;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Synchronous enhancement of a local video file. Errors are mapped by
 * {@link com.example.videoenhance.api.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/video-enhancement")
public class VideoEnhancementController {

    private static final Logger log = LoggerFactory.getLogger(VideoEnhancementController.class);

    @Autowired
    private VideoEnhancementPipeline pipeline;

    @Autowired
    private EnhancementEstimator estimator;

    @Autowired
    private EnhancementProperties properties;

    @PostMapping
    public ResponseEntity<ApiResponse<EnhancementResult>> enhance(@Valid @RequestBody EnhancementRequest request) {
        EnhancementConfig config = properties.toConfig();
        if (request.getConfig() != null) {
            request.getConfig().applyTo(config);
        }

        Path input = Paths.get(request.getInputPath());
        log.info("Enhancement requested for {}", input);
        EnhancementResult result = request.getOutputPath() == null || request.getOutputPath().isBlank()
            ? pipeline.enhanceVideo(input, config)
            : pipeline.enhanceVideo(input, Paths.get(request.getOutputPath()), config);

        String message = result.getDegradedGroupCount() > 0
            ? "Video enhanced with " + result.getDegradedGroupCount() + " degraded group(s)"
            : "Video enhanced";
        return ResponseEntity.ok(ApiResponse.ok(message, result));
    }

    /**
     * Rough processing time before committing to a run.
     */
    @GetMapping("/estimate")
    public ResponseEntity<ApiResponse<Map<String, Object>>> estimate(@RequestParam double durationSeconds,
                                                                     @RequestParam(defaultValue = "30") double frameRate) {
        double seconds = estimator.estimateSeconds(durationSeconds, frameRate);

        Map<String, Object> response = new HashMap<>();
        response.put("durationSeconds", durationSeconds);
        response.put("frameRate", frameRate);
        response.put("estimatedSeconds", seconds);
        response.put("acceptedDuration", durationSeconds <= properties.getMaxDurationSeconds());
        return ResponseEntity.ok(ApiResponse.ok(response));
    }
}
