package com.ssomonitor.detection.client;

import com.ssomonitor.detection.exception.ClassificationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Line protocol client: one connection per request, sends {@code <path>[ noSave]\n} and reads a single
 * reply of at most 1024 bytes. A reply containing {@code YES} is positive.
 */
@Slf4j
public class SocketClassificationOracle implements ClassificationOracle {

    private static final int REPLY_BUFFER_SIZE = 1024;
    private static final String NO_SAVE_FLAG = " noSave";

    private final String host;
    private final int port;
    private final Duration timeout;
    private final boolean noSave;

    public SocketClassificationOracle(String host, int port, Duration timeout, boolean noSave) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
        this.noSave = noSave;
    }

    @Override
    public ClassificationVerdict classify(String imageReference) {
        String endpoint = host + ":" + port;
        String request = imageReference + (noSave ? NO_SAVE_FLAG : "") + "\n";
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);

            OutputStream out = socket.getOutputStream();
            out.write(request.getBytes(StandardCharsets.US_ASCII));
            out.flush();

            InputStream in = socket.getInputStream();
            byte[] buffer = new byte[REPLY_BUFFER_SIZE];
            int read = in.read(buffer);
            if (read <= 0) {
                throw ClassificationException.emptyReply(endpoint);
            }
            String reply = new String(buffer, 0, read, StandardCharsets.UTF_8).trim();
            log.debug("Oracle {} answered for {}: {}", endpoint, imageReference, reply);

            if (reply.startsWith("Error")) {
                throw ClassificationException.oracleError(reply);
            }
            return reply.contains("YES")
                    ? ClassificationVerdict.loginPresent(reply)
                    : ClassificationVerdict.notPresent(reply);
        } catch (IOException e) {
            throw ClassificationException.connectionFailed(endpoint, e);
        }
    }

    @Override
    public ClassificationOracle withTimeout(Duration newTimeout) {
        return new SocketClassificationOracle(host, port, newTimeout, noSave);
    }
}
