package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.client.DiscoverySourceClient;
import com.ssomonitor.detection.client.DiscoverySourceClient.FetchedResource;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.ArtifactsConfig;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.LoginPageConfig;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.RobotsStrategyConfig;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.UrlRegexRule;
import com.ssomonitor.detection.dto.Priority;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.dto.info.RobotsInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.SourceFetchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RobotsStrategyTest {

    private static final String ROBOTS_URL = "https://example.com/robots.txt";
    private static final ResolvedTarget RESOLVED = new ResolvedTarget("https://example.com/", "example.com", true);

    @Mock
    private DiscoverySourceClient sourceClient;

    @Mock
    private CandidateVerifier verifier;

    @Mock
    private ClassificationOracle oracle;

    @InjectMocks
    private RobotsStrategy robotsStrategy;

    @Test
    @DisplayName("Disallow: /login + login 규칙 + YES 판정이면 후보 하나")
    void acceptsConfirmedLoginPath() {
        // given
        StrategyContext context = context(List.of(new UrlRegexRule("login", 5)), null, false);
        when(sourceClient.fetch(ROBOTS_URL, Duration.ofSeconds(10)))
                .thenReturn(robots("User-agent: *\nDisallow: /login\n"));
        when(verifier.verify("https://example.com/login", LoginPageStrategyType.ROBOTS, oracle))
                .thenReturn(CandidateVerifier.Outcome.ACCEPTED);

        // when
        List<Candidate> candidates = robotsStrategy.discover(context);

        // then
        assertThat(candidates).hasSize(1);
        Candidate candidate = candidates.get(0);
        assertThat(candidate.url()).isEqualTo("https://example.com/login");
        assertThat(candidate.strategy()).isEqualTo(LoginPageStrategyType.ROBOTS);
        assertThat(candidate.priority()).isEqualTo(new Priority(5, "login"));
        assertThat(candidate.info()).isEqualTo(new RobotsInfo("/login", "disallow"));
        assertThat(candidate.actions()).isNull();
    }

    @Test
    @DisplayName("우선순위 내림차순 정렬, 중복 제거, 최대 개수로 자르기")
    void sortsDeduplicatesAndTruncates() {
        // given
        StrategyContext context = context(
                List.of(new UrlRegexRule("login", 2), new UrlRegexRule("admin", 7)),
                new RobotsStrategyConfig(1, 5), false);
        when(sourceClient.fetch(ROBOTS_URL, Duration.ofSeconds(5))).thenReturn(robots("""
                User-agent: *
                Disallow: /login
                Allow: /login
                Disallow: /admin/login
                Disallow: /about
                """));
        when(verifier.verify(anyString(), eq(LoginPageStrategyType.ROBOTS), any()))
                .thenReturn(CandidateVerifier.Outcome.ACCEPTED);

        // when
        List<Candidate> candidates = robotsStrategy.discover(context);

        // then
        assertThat(candidates).extracting(Candidate::url).containsExactly("https://example.com/admin/login");
        verify(verifier, times(2)).verify(anyString(), eq(LoginPageStrategyType.ROBOTS), any());
        verify(verifier, never()).verify(eq("https://example.com/about"), any(), any());
    }

    @Test
    @DisplayName("거부되거나 건너뛴 URL은 후보가 아니다")
    void rejectedAndSkippedAreDropped() {
        // given
        StrategyContext context = context(List.of(new UrlRegexRule("login", 5)), null, false);
        when(sourceClient.fetch(ROBOTS_URL, Duration.ofSeconds(10)))
                .thenReturn(robots("Disallow: /login\nDisallow: /login/sso\n"));
        when(verifier.verify("https://example.com/login", LoginPageStrategyType.ROBOTS, oracle))
                .thenReturn(CandidateVerifier.Outcome.REJECTED);
        when(verifier.verify("https://example.com/login/sso", LoginPageStrategyType.ROBOTS, oracle))
                .thenReturn(CandidateVerifier.Outcome.SKIPPED);

        // when / then
        assertThat(robotsStrategy.discover(context)).isEmpty();
    }

    @Test
    @DisplayName("text/plain이 아니면 아무것도 하지 않는다")
    void ignoresNonPlainText() {
        // given
        StrategyContext context = context(List.of(new UrlRegexRule("login", 5)), null, true);
        when(sourceClient.fetch(ROBOTS_URL, Duration.ofSeconds(10))).thenReturn(new FetchedResource(
                ROBOTS_URL, 200, "text/html", "<html>Disallow: /login</html>".getBytes(StandardCharsets.UTF_8)));

        // when
        List<Candidate> candidates = robotsStrategy.discover(context);

        // then
        assertThat(candidates).isEmpty();
        assertThat(context.result().getRobots()).isNull();
        verify(verifier, never()).verify(anyString(), any(), any());
    }

    @Test
    @DisplayName("네트워크 오류는 빈 결과")
    void networkErrorYieldsNothing() {
        // given
        StrategyContext context = context(List.of(new UrlRegexRule("login", 5)), null, false);
        when(sourceClient.fetch(ROBOTS_URL, Duration.ofSeconds(10)))
                .thenThrow(new SourceFetchException("connection refused"));

        // when / then
        assertThat(robotsStrategy.discover(context)).isEmpty();
    }

    @Test
    @DisplayName("store_robots이면 robots.txt 원문을 결과에 저장")
    void storesRobotsArtifact() {
        // given
        String text = "User-agent: *\nDisallow: /private\n";
        StrategyContext context = context(List.of(new UrlRegexRule("login", 5)), null, true);
        when(sourceClient.fetch(ROBOTS_URL, Duration.ofSeconds(10))).thenReturn(robots(text));

        // when
        robotsStrategy.discover(context);

        // then
        assertThat(context.result().getRobots()).isEqualTo(text);
    }

    private StrategyContext context(List<UrlRegexRule> rules, RobotsStrategyConfig robotsConfig, boolean storeRobots) {
        LoginPageAnalysisConfig config = new LoginPageAnalysisConfig(
                new LoginPageConfig(List.of(LoginPageStrategyType.ROBOTS), rules, robotsConfig, null, null),
                new ArtifactsConfig(storeRobots, false));
        return new StrategyContext("example.com", RESOLVED, config, oracle, AnalysisResult.forTarget(RESOLVED));
    }

    private static FetchedResource robots(String body) {
        return new FetchedResource(ROBOTS_URL, 200, "text/plain; charset=utf-8", body.getBytes(StandardCharsets.UTF_8));
    }
}
