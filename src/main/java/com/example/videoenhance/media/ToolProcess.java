package com.example.videoenhance.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Runs an external tool (ffmpeg, ffprobe) to completion with stderr merged into
 * stdout, and fails on a non-zero exit.
 */
final class ToolProcess {

    private static final Logger log = LoggerFactory.getLogger(ToolProcess.class);

    private static final int TAIL_LINES = 20;

    private ToolProcess() {
    }

    /**
     * @return everything the tool printed
     * @throws ToolInvocationException if the tool cannot be started, is interrupted, or exits non-zero
     */
    static String run(List<String> command) {
        String tool = command.get(0);
        log.debug("Executing: {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolInvocationException("Cannot start " + tool + ": " + e.getMessage(), e);
        }

        StringBuilder output = new StringBuilder();
        Deque<String> tail = new ArrayDeque<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append('\n');
                tail.addLast(line);
                if (tail.size() > TAIL_LINES) {
                    tail.removeFirst();
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.error("{} exited with code {}:\n{}", tool, exitCode, String.join("\n", tail));
                throw new ToolInvocationException(tool + " exited with code " + exitCode + ": "
                    + (tail.isEmpty() ? "" : tail.peekLast()), exitCode);
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ToolInvocationException("Failed reading " + tool + " output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(tool + " interrupted", e);
        }
        return output.toString();
    }
}
