/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Exposes target metrics on {@code http://0.0.0.0:<metrics.prometheus.port>/metrics}.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    private static final String PATH = "/metrics";

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsUtil.applyCommonTags(reg, s);

        final ServerHandle handle = start(reg, s.prometheusPort);
        log.info("Prometheus Metrics Active (port={}, path={})", handle.port(), PATH);

        return new MicrometerMetricsRuntime("PROMETHEUS", () -> {
            handle.close();
            reg.close();
        }).addRegistry(reg);
    }

    private static ServerHandle start(PrometheusMeterRegistry registry, int port) {
        Objects.requireNonNull(registry, "registry");

        try {
            final HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "metrics-http-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.createContext(PATH, exchange -> {
                try {
                    final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                } catch (IOException e) {
                    log.debug("Metrics scrape failed: {}", e.getMessage());
                    exchange.sendResponseHeaders(500, -1);
                } finally {
                    exchange.close();
                }
            });

            server.start();
            return new ServerHandle(server, executor);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start Prometheus metrics server on port " + port, e);
        }
    }

    private static final class ServerHandle implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ServerHandle(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
