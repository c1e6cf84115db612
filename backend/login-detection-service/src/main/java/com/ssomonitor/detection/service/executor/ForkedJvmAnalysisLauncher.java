package com.ssomonitor.detection.service.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ssomonitor.detection.DetectionWorkerApplication;
import com.ssomonitor.detection.config.WorkerProperties;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.exception.AnalysisLaunchException;
import com.ssomonitor.detection.util.ProcessOutputPump;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs each analysis in a child JVM started from this application's own classpath with
 * {@code worker.role=analysis}. Request and result travel as JSON files in the executor work directory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ForkedJvmAnalysisLauncher implements AnalysisLauncher {

    public static final String REQUEST_ARGUMENT = "worker.analysis.request-file";
    public static final String RESULT_ARGUMENT = "worker.analysis.result-file";

    private final WorkerProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public RunningAnalysis launch(TaskMessage task) {
        String exchangeId = UUID.randomUUID().toString();
        Path workDirectory = Path.of(properties.getExecutor().getWorkDirectory());
        Path requestFile = workDirectory.resolve(exchangeId + "-request.json");
        Path resultFile = workDirectory.resolve(exchangeId + "-result.json");

        try {
            Files.createDirectories(workDirectory);
            objectMapper.writeValue(requestFile.toFile(), new AnalysisRequest(
                    task.getTaskId(), task.getAnalysisName(), task.getDomain(), task.getAnalysisConfig()));

            List<String> command = command(requestFile, resultFile);
            log.info("Launching analysis process for {}: {}", task.getDomain(), command);
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            ProcessOutputPump.start(process, "analysis");
            return new ForkedAnalysis(process, requestFile, resultFile);
        } catch (IOException e) {
            deleteQuietly(requestFile);
            throw AnalysisLaunchException.of(task.getTaskId(), e);
        }
    }

    List<String> command(Path requestFile, Path resultFile) {
        List<String> command = new ArrayList<>();
        String javaCommand = properties.getExecutor().getJavaCommand();
        command.add(javaCommand == null || javaCommand.isBlank()
                ? Path.of(System.getProperty("java.home"), "bin", "java").toString()
                : javaCommand);
        command.addAll(properties.getExecutor().getJvmOptions());

        String classPath = System.getProperty("java.class.path");
        if (!classPath.contains(File.pathSeparator) && classPath.endsWith(".jar")) {
            command.add("-jar");
            command.add(classPath);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(DetectionWorkerApplication.class.getName());
        }

        command.add("--worker.role=" + WorkerProperties.ROLE_ANALYSIS);
        command.add("--" + REQUEST_ARGUMENT + "=" + requestFile.toAbsolutePath());
        command.add("--" + RESULT_ARGUMENT + "=" + resultFile.toAbsolutePath());
        command.add("--worker.backend.guidance.enabled=false");
        command.add("--worker.backend.triage.enabled=false");
        return command;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete analysis exchange file {}: {}", file, e.getMessage());
        }
    }

    private class ForkedAnalysis implements RunningAnalysis {

        private final Process process;
        private final Path requestFile;
        private final Path resultFile;

        ForkedAnalysis(Process process, Path requestFile, Path resultFile) {
            this.process = process;
            this.requestFile = requestFile;
            this.resultFile = resultFile;
        }

        @Override
        public boolean awaitCompletion(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            try {
                if (!process.waitFor(10, TimeUnit.SECONDS)) {
                    log.warn("Analysis process {} did not terminate after kill", process.pid());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                deleteQuietly(requestFile);
                deleteQuietly(resultFile);
            }
        }

        @Override
        public AnalysisResult result() {
            try {
                int exitStatus = process.exitValue();
                if (Files.isRegularFile(resultFile)) {
                    return objectMapper.readValue(resultFile.toFile(), AnalysisResult.class);
                }
                return AnalysisResult.failure("Analysis process exited with status " + exitStatus
                        + " without writing a result");
            } catch (IOException e) {
                log.error("Could not read analysis result {}: {}", resultFile, e.getMessage());
                return AnalysisResult.failure("Unreadable analysis result: " + e.getMessage());
            } finally {
                deleteQuietly(requestFile);
                deleteQuietly(resultFile);
            }
        }
    }
}
