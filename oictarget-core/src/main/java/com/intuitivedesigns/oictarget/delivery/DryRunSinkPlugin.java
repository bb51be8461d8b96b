/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.delivery;

import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.core.BatchEnvelope;
import com.intuitivedesigns.oictarget.core.BatchSink;
import com.intuitivedesigns.oictarget.core.DeliveryOutcome;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import com.intuitivedesigns.oictarget.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Logs each batch instead of sending it. No token is requested and every batch succeeds.
 */
public final class DryRunSinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(DryRunSinkPlugin.class);

    private static final int MAX_PREVIEW_CHARS = 256;

    @Override
    public String id() {
        return TargetSettings.SINK_DRY_RUN;
    }

    @Override
    public BatchSink create(TargetSettings settings, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        log.info("Initialized DRY_RUN sink. Batches will be logged, not sent.");

        return new BatchSink() {
            @Override
            public DeliveryOutcome deliver(BatchEnvelope batch) {
                if (log.isInfoEnabled()) {
                    String preview = batch.isEmpty() ? "" : String.valueOf(batch.records().get(0));
                    if (preview.length() > MAX_PREVIEW_CHARS) {
                        preview = preview.substring(0, MAX_PREVIEW_CHARS) + "... [TRUNCATED]";
                    }
                    log.info("[DRY_RUN] POST {} batch={} seq={} records={} first={}",
                            settings.endpointPath(batch.stream()), batch.batchId(), batch.sequence(), batch.size(), preview);
                }
                return DeliveryOutcome.success(batch.size(), 0, 1);
            }

            @Override
            public String id() {
                return TargetSettings.SINK_DRY_RUN;
            }
        };
    }
}
