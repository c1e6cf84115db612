package com.ssomonitor.detection.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlGuidanceServerTest {

    @Mock
    private CrawlSession session;

    @Test
    @DisplayName("한 연결의 요청은 하나의 세션이 순서대로 처리")
    void repliesInRequestOrder() {
        // given
        AtomicInteger sessions = new AtomicInteger();
        CrawlGuidanceServer server = new CrawlGuidanceServer("127.0.0.1", 0, () -> {
            sessions.incrementAndGet();
            return session;
        });
        when(session.handle("flow_0/page_1.png")).thenReturn(CrawlSession.NO_POPUPS);
        when(session.handle("flow_0/page_2.png")).thenReturn("Click Point: 640, 40");

        // when / then
        StepVerifier.create(server.replies(Flux.just("flow_0/page_1.png", "flow_0/page_2.png")))
                .expectNext(CrawlSession.NO_POPUPS)
                .expectNext("Click Point: 640, 40")
                .verifyComplete();
        assertThat(sessions).hasValue(1);
    }
}
