/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.app;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.config.PipelineFactory;
import com.intuitivedesigns.telemetrykernel.core.ChainOrchestrator;
import com.intuitivedesigns.telemetrykernel.output.KafkaEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class TelemetryKernelApp {

    private static final Logger log = LoggerFactory.getLogger(TelemetryKernelApp.class);

    // --- Config Keys ---
    private static final String CFG_SPEEDOMETER_ENABLED = "tk.speedometer.enabled";
    private static final String CFG_SPEEDOMETER_WINDOW_SECONDS = "tk.speedometer.window.seconds";

    // --- Defaults ---
    private static final int DEFAULT_WINDOW_SECONDS = 10;
    private static final int MIN_WINDOW_SECONDS = 5;
    private static final int MAX_WINDOW_SECONDS = 60;

    private TelemetryKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting TelemetryKernel ===");

        final PipelineConfig config = PipelineConfig.load();
        PipelineFactory.logAvailablePlugins();

        TelemetryKernel kernel = null;
        ScheduledExecutorService speedometerScheduler = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            kernel = TelemetryKernel.assemble(config);

            final boolean speedometerEnabled = config.getBoolean(CFG_SPEEDOMETER_ENABLED, true);
            final int windowSeconds = clampInt(
                    config.getInt(CFG_SPEEDOMETER_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                    MIN_WINDOW_SECONDS,
                    MAX_WINDOW_SECONDS
            );

            if (speedometerEnabled) {
                speedometerScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("tk-speedometer"));
                final KafkaEventSink kafkaSink = (kernel.sink() instanceof KafkaEventSink ks) ? ks : null;
                startSpeedometer(speedometerScheduler, kernel.orchestrator(), kafkaSink, windowSeconds);
            }

            final TelemetryKernel finalKernel = kernel;
            final ScheduledExecutorService finalScheduler = speedometerScheduler;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }
                log.info("Shutdown signal received.");
                try {
                    if (finalScheduler != null) {
                        finalScheduler.shutdownNow();
                    }
                    finalKernel.close();
                } finally {
                    shutdownLatch.countDown();
                }
            }, "tk-shutdown"));

            log.info("Starting chain orchestrator...");
            kernel.start();

            shutdownLatch.await();
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                if (speedometerScheduler != null) {
                    speedometerScheduler.shutdownNow();
                }
                TelemetryKernel.closeQuietly(kernel);
                shutdownLatch.countDown();
            }

            System.exit(1);
        }
    }

    private static void startSpeedometer(ScheduledExecutorService scheduler,
                                         ChainOrchestrator orchestrator,
                                         KafkaEventSink kafkaSink,
                                         int windowSeconds) {
        log.info("Speedometer active ({}s window, kafka={})", windowSeconds, kafkaSink != null);
        final Speedometer speedometer = new Speedometer(orchestrator, kafkaSink, System::nanoTime);
        scheduler.scheduleAtFixedRate(speedometer, windowSeconds, windowSeconds, TimeUnit.SECONDS);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
