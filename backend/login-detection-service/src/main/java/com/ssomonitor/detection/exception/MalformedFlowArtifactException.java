package com.ssomonitor.detection.exception;

import java.nio.file.Path;

/**
 * Crawler output that does not follow the flow/page naming rule or whose action log cannot be read.
 */
public class MalformedFlowArtifactException extends WorkerException {

    public MalformedFlowArtifactException(String message) {
        super("FLOW_ARTIFACT_ERROR", message);
    }

    public MalformedFlowArtifactException(String message, Throwable cause) {
        super("FLOW_ARTIFACT_ERROR", message, cause);
    }

    public static MalformedFlowArtifactException badName(Path path, String expected) {
        return new MalformedFlowArtifactException("Unexpected crawler artifact name '" + path.getFileName()
                + "' in " + path.getParent() + ", expected " + expected);
    }

    public static MalformedFlowArtifactException unreadable(Path path, Throwable cause) {
        return new MalformedFlowArtifactException("Could not read crawler artifact " + path + ": " + cause.getMessage(), cause);
    }
}
