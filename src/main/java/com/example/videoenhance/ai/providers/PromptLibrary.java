package com.example.videoenhance.ai.providers;

import com.example.videoenhance.model.CritiqueIssue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Prompt texts sent to the AI services, loaded once from resource files.
 */
@Component
public class PromptLibrary {

    private final String enhancementInstruction;
    private final String analysisPrompt;

    public PromptLibrary(ResourceLoader resourceLoader,
                         @Value("${enhancement.prompts.enhancement:classpath:prompts/video-enhancement-system.txt}") String enhancementLocation,
                         @Value("${enhancement.prompts.analysis:classpath:prompts/video-enhancement-analysis.txt}") String analysisLocation) {
        this.enhancementInstruction = load(resourceLoader, enhancementLocation);
        this.analysisPrompt = load(resourceLoader, analysisLocation);
    }

    /**
     * The fixed creative instruction, with the user's feedback appended when present.
     */
    public String enhancementInstruction(String userFeedback) {
        if (userFeedback == null || userFeedback.isBlank()) {
            return enhancementInstruction;
        }
        return enhancementInstruction + "\n\nADDITIONAL USER FEEDBACK:\n" + userFeedback.trim();
    }

    /**
     * Instruction for a global retry: the original instruction followed by a numbered
     * list of what the critique still found wrong.
     */
    public String retryInstruction(String baseInstruction, List<CritiqueIssue> issues) {
        StringBuilder sb = new StringBuilder(baseInstruction);
        sb.append("\n\nApply these specific improvements to the video frame:\n");
        for (int i = 0; i < issues.size(); i++) {
            sb.append(i + 1).append(". ").append(issues.get(i).description()).append('\n');
        }
        return sb.toString();
    }

    public String analysisPrompt() {
        return analysisPrompt;
    }

    private static String load(ResourceLoader resourceLoader, String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load prompt " + location, e);
        }
    }
}
