package com.ssomonitor.detection.service.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.service.LoginPageAnalysisService;
import com.ssomonitor.detection.util.MdcContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Body of the isolated analysis process: reads the request file, analyses the domain and writes the
 * result file. Analysis failures are written as results; only I/O on the exchange files fails the process.
 */
@Component
@ConditionalOnProperty(name = "worker.role", havingValue = "analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisProcessRunner implements ApplicationRunner {

    private final LoginPageAnalysisService analysisService;
    private final ObjectMapper objectMapper;
    private final Environment environment;

    @Override
    public void run(ApplicationArguments args) {
        Path requestFile = Path.of(environment.getRequiredProperty(ForkedJvmAnalysisLauncher.REQUEST_ARGUMENT));
        Path resultFile = Path.of(environment.getRequiredProperty(ForkedJvmAnalysisLauncher.RESULT_ARGUMENT));

        AnalysisRequest request;
        try {
            request = objectMapper.readValue(requestFile.toFile(), AnalysisRequest.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read analysis request " + requestFile, e);
        }

        MdcContext.setTask(request.taskId(), request.analysisName());
        AnalysisResult result;
        try {
            result = analysisService.analyze(request.domain(), request.config());
        } catch (RuntimeException e) {
            log.error("Login page analysis of {} failed: {}", request.domain(), e.getMessage(), e);
            result = AnalysisResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            MdcContext.clearStrategy();
        }

        try {
            objectMapper.writeValue(resultFile.toFile(), result);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write analysis result " + resultFile, e);
        } finally {
            MdcContext.clear();
        }
        log.info("Analysis result written to {}", resultFile);
    }
}
