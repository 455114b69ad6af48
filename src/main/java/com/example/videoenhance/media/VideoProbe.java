package com.example.videoenhance.media;

import com.example.videoenhance.model.VideoMetadata;

import java.nio.file.Path;

public interface VideoProbe {

    /**
     * @throws ToolInvocationException if the file cannot be probed or has no video stream
     */
    VideoMetadata probe(Path video);
}
