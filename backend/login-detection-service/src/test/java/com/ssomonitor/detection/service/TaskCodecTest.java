package com.ssomonitor.detection.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.LoginPageConfig;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.dto.info.RobotsInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.entity.TaskState;
import com.ssomonitor.detection.exception.TaskDecodingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskCodecTest {

    private static final String ANALYSIS = "login_page_analysis";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TaskCodec codec = new TaskCodec(objectMapper);

    @Test
    @DisplayName("설정 섹션을 타입으로 읽고 빠진 값은 기본값")
    void decodesConfig() {
        // given
        String json = """
                {"domain": "example.com",
                 "login_page_analysis_config": {
                   "login_page_config": {
                     "login_page_strategy_scope": ["ROBOTS", "metasearch"],
                     "login_page_url_regexes": [{"regex": "login", "priority": 5}],
                     "robots_strategy_config": {"max_candidates": 3}
                   },
                   "artifacts_config": {"store_robots": true, "store_sitemap": false}
                 },
                 "task_config": {"task_id": "t-1", "reply_to": "http://callback/t-1", "task_state": "RECEIVED"}}
                """;

        // when
        TaskMessage task = codec.decode(json, ANALYSIS);

        // then
        assertThat(task.getDomain()).isEqualTo("example.com");
        assertThat(task.getTaskId()).isEqualTo("t-1");
        assertThat(task.getReplyTo()).isEqualTo("http://callback/t-1");
        LoginPageConfig loginPageConfig = task.getAnalysisConfig().loginPageConfig();
        assertThat(loginPageConfig.strategyScope())
                .containsExactly(LoginPageStrategyType.ROBOTS, LoginPageStrategyType.METASEARCH);
        assertThat(loginPageConfig.urlRegexes()).singleElement()
                .satisfies(rule -> assertThat(rule.priority()).isEqualTo(5));
        assertThat(loginPageConfig.robots().maxCandidates()).isEqualTo(3);
        assertThat(loginPageConfig.robots().timeoutFetchRobots()).isEqualTo(10);
        assertThat(loginPageConfig.sitemap().maxRecursionLevel()).isEqualTo(3);
        assertThat(task.getAnalysisConfig().artifactsConfig().storeRobots()).isTrue();
    }

    @Test
    @DisplayName("설정과 task_config가 없어도 기본값으로 디코딩")
    void decodesMinimalTask() {
        TaskMessage task = codec.decode("{\"domain\": \"example.com\"}", ANALYSIS);

        assertThat(task.getTaskConfig()).isNotNull();
        assertThat(task.getTaskId()).isNull();
        assertThat(task.getAnalysisConfig().loginPageConfig().strategyScope())
                .containsExactly(LoginPageStrategyType.values());
        assertThat(task.getScanDomain()).isEqualTo("example.com");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[1, 2]",
            "{\"task_config\": {}}",
            "{\"domain\": \"  \"}",
            "{\"domain\": \"example.com\", \"login_page_analysis_config\": {\"login_page_config\": {\"login_page_strategy_scope\": [\"DNS\"]}}}"
    })
    @DisplayName("작업 문서가 아니면 TaskDecodingException")
    void rejectsInvalidPayloads(String payload) {
        assertThatThrownBy(() -> codec.decode(payload, ANALYSIS))
                .isInstanceOf(TaskDecodingException.class);
    }

    @Test
    @DisplayName("scan_config.domain이 있으면 그 값을 스캔 도메인으로")
    void scanConfigOverridesDomain() {
        TaskMessage task = codec.decode(
                "{\"domain\": \"www.example.com\", \"scan_config\": {\"domain\": \"example.com\"}}", ANALYSIS);

        assertThat(task.getScanDomain()).isEqualTo("example.com");
    }

    @Test
    @DisplayName("모르는 필드와 원본 설정은 그대로 돌려보내고 결과를 덧붙인다")
    void encodePreservesUnknownFields() throws Exception {
        // given
        String json = """
                {"domain": "example.com",
                 "scan_config": {"domain": "example.com", "depth": 2},
                 "login_page_analysis_config": {"login_page_config": {"custom": "kept"}},
                 "task_config": {"task_id": "t-9", "task_state": "RECEIVED", "origin": "scheduler"},
                 "landscape_analysis_result": {"ok": true}}
                """;
        TaskMessage task = codec.decode(json, ANALYSIS);
        task.getTaskConfig().transitionTo(TaskState.RUNNING, Instant.ofEpochSecond(42));
        AnalysisResult result = AnalysisResult.forTarget(new ResolvedTarget("https://example.com/", "example.com", true));
        result.addCandidates(List.of(Candidate.builder()
                .url("https://example.com/login")
                .strategy(LoginPageStrategyType.ROBOTS)
                .info(new RobotsInfo("/login", "disallow"))
                .build()));
        task.setAnalysisResult(result);

        // when
        JsonNode encoded = objectMapper.readTree(codec.encode(task));

        // then
        assertThat(encoded.get("domain").asText()).isEqualTo("example.com");
        assertThat(encoded.get("scan_config").get("depth").asInt()).isEqualTo(2);
        assertThat(encoded.get("landscape_analysis_result").get("ok").asBoolean()).isTrue();
        assertThat(encoded.get("login_page_analysis_config"))
                .isEqualTo(objectMapper.readTree("{\"login_page_config\": {\"custom\": \"kept\"}}"));
        JsonNode taskConfig = encoded.get("task_config");
        assertThat(taskConfig.get("task_id").asText()).isEqualTo("t-9");
        assertThat(taskConfig.get("origin").asText()).isEqualTo("scheduler");
        assertThat(taskConfig.get("task_state").asText()).isEqualTo("RUNNING");
        assertThat(taskConfig.get("task_timestamp_analysis_started").asLong()).isEqualTo(42L);
        JsonNode candidate = encoded.get("login_page_analysis_result").get("login_page_candidates").get(0);
        assertThat(candidate.get("login_page_candidate").asText()).isEqualTo("https://example.com/login");
        assertThat(candidate.get("login_page_strategy").asText()).isEqualTo("ROBOTS");
        assertThat(candidate.get("login_page_info").get("type").asText()).isEqualTo("ROBOTS");
        assertThat(candidate.has("login_page_actions")).isFalse();
    }

    @Test
    @DisplayName("시간 초과 결과는 exception 하나만 담는다")
    void timeoutResultCarriesOnlyMarker() throws Exception {
        TaskMessage task = codec.decode("{\"domain\": \"example.com\"}", ANALYSIS);
        task.setAnalysisResult(AnalysisResult.timeout());

        JsonNode result = objectMapper.readTree(codec.encode(task)).get("login_page_analysis_result");

        assertThat(result).isEqualTo(objectMapper.readTree("{\"exception\": \"Process timeout\"}"));
    }
}
