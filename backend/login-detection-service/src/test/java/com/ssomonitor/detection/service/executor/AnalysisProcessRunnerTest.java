package com.ssomonitor.detection.service.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.dto.info.RobotsInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.SourceFetchException;
import com.ssomonitor.detection.service.LoginPageAnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisProcessRunnerTest {

    @TempDir
    Path exchange;

    @Mock
    private LoginPageAnalysisService analysisService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Path requestFile;
    private Path resultFile;
    private AnalysisProcessRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        requestFile = exchange.resolve("x-request.json");
        resultFile = exchange.resolve("x-result.json");
        objectMapper.writeValue(requestFile.toFile(),
                new AnalysisRequest("t-1", "login_page_analysis", "example.com", LoginPageAnalysisConfig.defaults()));
        MockEnvironment environment = new MockEnvironment()
                .withProperty(ForkedJvmAnalysisLauncher.REQUEST_ARGUMENT, requestFile.toString())
                .withProperty(ForkedJvmAnalysisLauncher.RESULT_ARGUMENT, resultFile.toString());
        runner = new AnalysisProcessRunner(analysisService, objectMapper, environment);
    }

    @Test
    @DisplayName("요청 파일의 도메인을 분석해 결과 파일로 쓴다")
    void writesResultFile() throws IOException {
        // given
        AnalysisResult result = AnalysisResult.forTarget(new ResolvedTarget("https://example.com/", "example.com", true));
        result.addCandidates(List.of(Candidate.builder()
                .url("https://example.com/login")
                .strategy(LoginPageStrategyType.ROBOTS)
                .info(new RobotsInfo("/login", "disallow"))
                .build()));
        when(analysisService.analyze(eq("example.com"), any(LoginPageAnalysisConfig.class))).thenReturn(result);

        // when
        runner.run(new DefaultApplicationArguments());

        // then
        AnalysisResult written = objectMapper.readValue(resultFile.toFile(), AnalysisResult.class);
        assertThat(written.getResolved()).isEqualTo(result.getResolved());
        assertThat(written.getLoginPageCandidates()).singleElement()
                .satisfies(candidate -> assertThat(candidate.info()).isEqualTo(new RobotsInfo("/login", "disallow")));
    }

    @Test
    @DisplayName("분석 예외는 exception 결과로 기록")
    void failureBecomesResult() throws IOException {
        // given
        when(analysisService.analyze(eq("example.com"), any())).thenThrow(new SourceFetchException("robots.txt unreachable"));

        // when
        runner.run(new DefaultApplicationArguments());

        // then
        JsonNode written = objectMapper.readTree(resultFile.toFile());
        assertThat(written).isEqualTo(objectMapper.readTree("{\"exception\": \"robots.txt unreachable\"}"));
    }
}
