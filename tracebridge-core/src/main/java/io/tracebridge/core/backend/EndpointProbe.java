package io.tracebridge.core.backend;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TCP connect probe. Only checks that something accepts connections on the
 * endpoint's host and port; no protocol handshake.
 */
public final class EndpointProbe {
    private static final Logger LOG = LoggerFactory.getLogger(EndpointProbe.class);

    private EndpointProbe() {
    }

    public static boolean reachable(String endpoint, Duration timeout) {
        URI uri;
        try {
            uri = URI.create(endpoint == null ? "" : endpoint.trim());
        } catch (IllegalArgumentException e) {
            LOG.debug("Invalid endpoint {}: {}", endpoint, e.getMessage());
            return false;
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return false;
        }
        int port = uri.getPort() > 0 ? uri.getPort() : defaultPort(uri.getScheme());
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1, timeout.toMillis()));
            return true;
        } catch (IOException e) {
            LOG.debug("Endpoint {}:{} unreachable: {}", host, port, e.getMessage());
            return false;
        }
    }

    private static int defaultPort(String scheme) {
        return "https".equalsIgnoreCase(scheme) ? 443 : 80;
    }
}
