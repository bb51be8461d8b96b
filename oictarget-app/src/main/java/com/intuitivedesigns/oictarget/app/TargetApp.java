/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.app;

import com.intuitivedesigns.oictarget.config.TargetConfig;
import com.intuitivedesigns.oictarget.config.TargetFactory;
import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.error.ConfigurationException;
import com.intuitivedesigns.oictarget.metrics.MetricsFactory;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import com.intuitivedesigns.oictarget.metrics.MetricsSettings;
import com.intuitivedesigns.oictarget.pipeline.PipelineOrchestrator;
import com.intuitivedesigns.oictarget.singer.StdoutStateWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Singer target entry point: reads messages from stdin, writes emitted states to stdout.
 *
 * <p>Exit codes: 0 success, 1 run failure, 2 configuration error.
 */
public final class TargetApp {

    private static final Logger log = LoggerFactory.getLogger(TargetApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    private static final String USAGE = "Usage: target-oracle-oic [--config <path.json|path.properties>]";

    private TargetApp() {}

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, true));
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, boolean installShutdownHook) {
        log.info("=== Booting OIC Target ===");

        MetricsRuntime metrics = null;
        PipelineOrchestrator pipeline = null;
        Thread hook = null;

        try {
            final String configPath = parseConfigPath(args);
            final TargetConfig config = TargetConfig.load(configPath);
            final TargetSettings settings = TargetSettings.from(config);

            metrics = MetricsFactory.init(MetricsSettings.from(config));

            final TargetFactory factory = new TargetFactory();
            factory.logAvailableSinks();
            pipeline = factory.createOrchestrator(settings, new StdoutStateWriter(stdout), metrics);

            if (installShutdownHook) {
                hook = shutdownHook(pipeline);
                Runtime.getRuntime().addShutdownHook(hook);
            }

            BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            pipeline.run(in);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            log.debug("Configuration error detail", e);
            return EXIT_CONFIG;
        } catch (Exception e) {
            log.error("Target failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } finally {
            removeHook(hook);
            closeQuietly(pipeline);
            closeQuietly(metrics);
        }
    }

    static String parseConfigPath(String[] args) {
        String path = null;
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (arg.equals("--config") || arg.equals("-c")) {
                if (i + 1 >= args.length) throw new ConfigurationException("Missing value for " + arg + ". " + USAGE);
                path = args[++i];
            } else if (arg.startsWith("--config=")) {
                path = arg.substring("--config=".length());
            } else {
                throw new ConfigurationException("Unknown argument '" + arg + "'. " + USAGE);
            }
        }
        return path;
    }

    /**
     * On SIGTERM the buffered records are drained and delivered within the shutdown grace period.
     */
    private static Thread shutdownHook(PipelineOrchestrator pipeline) {
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
        return new Thread(() -> {
            if (!shutdownStarted.compareAndSet(false, true)) return;
            log.warn("Shutdown signal received. Draining buffered records...");
            try {
                pipeline.finish();
            } catch (RuntimeException e) {
                log.error("Graceful shutdown failed: {}", e.getMessage());
            }
        }, "oic-shutdown");
    }

    private static void removeHook(Thread hook) {
        if (hook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running
            log.debug("Shutdown in progress, hook stays registered");
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }
}
