package com.example.videoenhance.model;

/**
 * Stream properties of an input video, as reported by ffprobe.
 */
public class VideoMetadata {
    private double durationSeconds;
    private double frameRate;
    private int width;
    private int height;
    private String videoCodec;
    private String audioCodec;
    private long sizeBytes;

    public VideoMetadata() {}

    public VideoMetadata(double durationSeconds, double frameRate, int width, int height) {
        this.durationSeconds = durationSeconds;
        this.frameRate = frameRate;
        this.width = width;
        this.height = height;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public double getFrameRate() {
        return frameRate;
    }

    public void setFrameRate(double frameRate) {
        this.frameRate = frameRate;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public String getVideoCodec() {
        return videoCodec;
    }

    public void setVideoCodec(String videoCodec) {
        this.videoCodec = videoCodec;
    }

    public String getAudioCodec() {
        return audioCodec;
    }

    public void setAudioCodec(String audioCodec) {
        this.audioCodec = audioCodec;
    }

    public boolean hasAudio() {
        return audioCodec != null && !audioCodec.isEmpty();
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    @Override
    public String toString() {
        return String.format("VideoMetadata{%.2fs @ %.2ffps, %dx%d, video=%s, audio=%s, %d bytes}",
                           durationSeconds, frameRate, width, height, videoCodec, audioCodec, sizeBytes);
    }
}
