package com.ssomonitor.detection.service.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.ClickPosition;
import com.ssomonitor.detection.dto.CrawlAction;
import com.ssomonitor.detection.dto.info.CrawlingInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.MalformedFlowArtifactException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlFlowAnalyzerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CrawlFlowAnalyzer analyzer = new CrawlFlowAnalyzer(objectMapper);

    @TempDir
    Path workspace;

    private Path raw;
    private Path classified;

    @BeforeEach
    void setUp() throws IOException {
        raw = Files.createDirectories(workspace.resolve("screenshot_flows/example_com"));
        classified = workspace.resolve("output_images/example_com");
    }

    @Test
    @DisplayName("분류된 스크린샷이 없으면 후보도 없다")
    void missingClassifiedDirectory() {
        assertThat(analyzer.analyze(classified, raw)).isEmpty();
    }

    @Test
    @DisplayName("URL마다 가장 짧은 클릭 경로를 선택")
    void keepsShortestPathPerUrl() throws IOException {
        // given: flow_0 reaches /login after two clicks, flow_1 after one
        writeFlow(0,
                action(0, 10, 20, 1, "https://example.com/"),
                action(1, 30, 40, 2, "https://example.com/account"),
                action(2, null, null, 3, "https://example.com/login"));
        writeFlow(1,
                action(0, 50, 60, 1, "https://example.com/"),
                action(1, null, null, 2, "https://example.com/login"));
        classify(0, 3);
        classify(1, 2);

        // when
        List<Candidate> candidates = analyzer.analyze(classified, raw);

        // then
        assertThat(candidates).hasSize(1);
        Candidate login = candidates.get(0);
        assertThat(login.url()).isEqualTo("https://example.com/login");
        assertThat(login.strategy()).isEqualTo(LoginPageStrategyType.CRAWLING);
        assertThat(login.priority()).isNull();
        assertThat(login.info()).isEqualTo(new CrawlingInfo(1, 2, 1));
        assertThat(login.actions()).extracting(CrawlAction::clickPosition)
                .containsExactly(new ClickPosition(50, 60));
    }

    @Test
    @DisplayName("같은 길이면 먼저 찾은 흐름, 흐름 번호는 숫자 순서")
    void tieKeepsFirstFlowInNumericOrder() throws IOException {
        // given
        writeFlow(2,
                action(0, 1, 1, 1, "https://example.com/"),
                action(1, null, null, 2, "https://example.com/login"));
        writeFlow(10,
                action(0, 9, 9, 1, "https://example.com/"),
                action(1, null, null, 2, "https://example.com/login"));
        classify(10, 2);
        classify(2, 2);

        // when
        List<Candidate> candidates = analyzer.analyze(classified, raw);

        // then
        assertThat(candidates).hasSize(1);
        assertThat(((CrawlingInfo) candidates.get(0).info()).flow()).isEqualTo(2);
    }

    @Test
    @DisplayName("첫 화면이 로그인 페이지면 클릭 없이")
    void landingPageNeedsNoClicks() throws IOException {
        // given
        writeFlow(0,
                action(0, 10, 10, 1, "https://example.com/signin"),
                action(1, null, null, 2, "https://example.com/other"));
        classify(0, 1);

        // when
        List<Candidate> candidates = analyzer.analyze(classified, raw);

        // then
        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.url()).isEqualTo("https://example.com/signin");
            assertThat(candidate.actions()).isEmpty();
        });
    }

    @Test
    @DisplayName("이름 규칙을 어긴 산출물은 거부")
    void rejectsMalformedNames() throws IOException {
        // given
        writeFlow(0, action(0, null, null, 1, "https://example.com/"));
        Files.createDirectories(classified.resolve("flow_0"));
        Files.write(classified.resolve("flow_0/page_one.png"), new byte[]{1});

        // when / then
        assertThatThrownBy(() -> analyzer.analyze(classified, raw))
                .isInstanceOf(MalformedFlowArtifactException.class)
                .hasMessageContaining("page_one.png");
    }

    @Test
    @DisplayName("흐름 디렉터리 이름도 검증하고 숨김 파일은 무시")
    void rejectsMalformedFlowDirectory() throws IOException {
        // given
        Files.createDirectories(classified.resolve("flow-a"));
        Files.write(Files.createDirectories(classified).resolve(".DS_Store"), new byte[]{1});

        // when / then
        assertThatThrownBy(() -> analyzer.analyze(classified, raw))
                .isInstanceOf(MalformedFlowArtifactException.class)
                .hasMessageContaining("flow-a");
    }

    @Test
    @DisplayName("행동 로그가 없으면 실패")
    void missingActionLog() throws IOException {
        // given
        classify(3, 1);

        // when / then
        assertThatThrownBy(() -> analyzer.analyze(classified, raw))
                .isInstanceOf(MalformedFlowArtifactException.class)
                .hasMessageContaining("click_actions_flow_3.json");
    }

    private CrawlAction action(int step, Integer x, Integer y, int page, String url) {
        ClickPosition position = x == null ? null : new ClickPosition(x, y);
        return new CrawlAction(step, position, x == null ? null : "<a>link</a>",
                "/app/screenshot_flows/example_com/flow_x/page_" + page + ".png", url);
    }

    private void writeFlow(int flow, CrawlAction... actions) throws IOException {
        Path directory = Files.createDirectories(raw.resolve("flow_" + flow));
        objectMapper.writeValue(directory.resolve("click_actions_flow_" + flow + ".json").toFile(),
                new ArrayList<>(List.of(actions)));
    }

    private void classify(int flow, int page) throws IOException {
        Path directory = Files.createDirectories(classified.resolve("flow_" + flow));
        Files.write(directory.resolve("page_" + page + ".png"), new byte[]{1, 2, 3});
    }
}
