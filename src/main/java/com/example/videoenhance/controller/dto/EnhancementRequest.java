package com.example.videoenhance.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public class EnhancementRequest {

    @NotBlank
    private String inputPath;

    private String outputPath;

    @Valid
    private ConfigOverrides config;

    public EnhancementRequest() {
    }

    public EnhancementRequest(String inputPath, String outputPath, ConfigOverrides config) {
        this.inputPath = inputPath;
        this.outputPath = outputPath;
        this.config = config;
    }

    public String getInputPath() {
        return inputPath;
    }

    public void setInputPath(String inputPath) {
        this.inputPath = inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public ConfigOverrides getConfig() {
        return config;
    }

    public void setConfig(ConfigOverrides config) {
        this.config = config;
    }
}
