package com.example.videoenhance.media;

import com.example.videoenhance.ai.core.VideoEnhancementException;

/**
 * ffmpeg/ffprobe exited non-zero or could not be started. Fatal for the run.
 */
public class ToolInvocationException extends VideoEnhancementException {

    private final int exitCode;

    public ToolInvocationException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
