package com.example.videoenhance.ai.lut;

import com.example.videoenhance.ai.core.VideoEnhancementException;

/**
 * Before and after frames are not pixel-aligned, so no color transform can be derived.
 */
public class GeometryMismatchException extends VideoEnhancementException {

    public GeometryMismatchException(int beforeWidth, int beforeHeight, int afterWidth, int afterHeight) {
        super(String.format("Enhanced frame is %dx%d but original is %dx%d",
                            afterWidth, afterHeight, beforeWidth, beforeHeight));
    }
}
