package com.ssomonitor.detection.backend;

import io.netty.handler.codec.LineBasedFrameDecoder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.netty.DisposableServer;
import reactor.netty.tcp.TcpServer;

import java.nio.charset.StandardCharsets;

/**
 * TCP server speaking the crawler's line protocol: requests are newline terminated, replies are written
 * as they are, one per request, in request order.
 */
@Slf4j
public abstract class LineProtocolServer {

    private static final int MAX_LINE_LENGTH = 8192;

    private final String name;
    private final String host;
    private final int port;
    private volatile DisposableServer server;

    protected LineProtocolServer(String name, String host, int port) {
        this.name = name;
        this.host = host;
        this.port = port;
    }

    /**
     * Maps the requests of one connection to its replies. Called once per connection.
     */
    protected abstract Flux<String> replies(Flux<String> requests);

    public void start() {
        server = TcpServer.create()
                .host(host)
                .port(port)
                .doOnConnection(connection -> {
                    log.debug("{}: connection from {}", name, connection.address());
                    connection.addHandlerLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                })
                .handle((inbound, outbound) -> outbound.sendString(
                        replies(inbound.receive()
                                .asString(StandardCharsets.UTF_8)
                                .map(String::trim)
                                .filter(line -> !line.isEmpty())),
                        StandardCharsets.UTF_8).then())
                .bindNow();
        log.info("{} listening on {}:{}", name, host, server.port());
    }

    public void stop() {
        DisposableServer current = server;
        if (current != null) {
            current.disposeNow();
            server = null;
            log.info("{} stopped", name);
        }
    }

    /**
     * Bound port, useful when started on port 0.
     */
    public int boundPort() {
        DisposableServer current = server;
        if (current == null) {
            throw new IllegalStateException(name + " is not running");
        }
        return current.port();
    }
}
