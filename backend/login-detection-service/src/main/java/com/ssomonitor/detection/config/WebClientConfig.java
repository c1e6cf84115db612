package com.ssomonitor.detection.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${worker.http.user-agent:Mozilla/5.0 (compatible; SSO-Monitor/1.0)}")
    private String userAgent;

    @Value("${worker.http.timeout.connect:10000}")
    private int connectTimeout;

    @Value("${worker.http.timeout.read:120000}")
    private int readTimeout;

    @Value("${worker.http.max-in-memory-size:67108864}")
    private int maxInMemorySize;

    /**
     * Client for service calls: collector, callback, metasearch and chat completion.
     */
    @Bean
    @Primary
    public WebClient webClient() {
        return build(true);
    }

    /**
     * Client for fetching robots.txt and sitemaps. Redirects are followed by the caller so the final URL is known.
     */
    @Bean
    public WebClient discoveryWebClient() {
        return build(false);
    }

    private WebClient build(boolean followRedirect) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
                .responseTimeout(Duration.ofMillis(readTimeout))
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(readTimeout, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readTimeout, TimeUnit.MILLISECONDS))
                )
                .followRedirect(followRedirect);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("User-Agent", userAgent)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();
    }
}
