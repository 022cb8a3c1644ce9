/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracing for one rule generation run.
 *
 * <p>A run produces a single {@code compile-process} trace with one child span per stage, so
 * tracing is off unless asked for and every span is kept once it is on. With the logging
 * exporter each span is written as soon as it ends; OTLP spans are queued and sent when the
 * run calls {@link #flush()} or {@link #shutdown()}.
 *
 * <p>Settings are read by {@link Settings#fromEnvironment()}.
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.normflow.rules";
    static final String DEFAULT_SERVICE_NAME = "normflow-rule-generator";
    static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    private static TracingService instance;

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    /**
     * Returns the process-wide service, created from {@link Settings#fromEnvironment()} on
     * first use.
     */
    public static synchronized TracingService getInstance() {
        if (instance == null) {
            instance = create(Settings.fromEnvironment());
        }
        return instance;
    }

    /**
     * Creates a standalone instance that records nothing.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    static TracingService create(Settings settings) {
        if (!settings.enabled()) {
            logger.fine("Tracing is disabled");
            return noop();
        }
        try {
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(Resource.getDefault().merge(Resource.create(
                            Attributes.of(AttributeKey.stringKey("service.name"), settings.serviceName()))))
                    .addSpanProcessor(spanProcessor(settings))
                    .build();
            logger.info(String.format("Tracing enabled: service=%s, exporter=%s",
                    settings.serviceName(), settings.exporter()));
            return new TracingService(provider.get(INSTRUMENTATION_NAME), provider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Could not set up tracing, continuing without it", e);
            return noop();
        }
    }

    private static SpanProcessor spanProcessor(Settings settings) {
        if (settings.exporter() == Exporter.OTLP) {
            return BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                    .setEndpoint(settings.otlpEndpoint())
                    .build()).build();
        }
        return SimpleSpanProcessor.create(LoggingSpanExporter.create());
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    /**
     * Exports every span ended so far. Called once the artifacts of a run are written.
     */
    public void flush() {
        if (tracerProvider != null
                && !tracerProvider.forceFlush().join(10, TimeUnit.SECONDS).isSuccess()) {
            logger.warning("Not all spans were exported");
        }
    }

    /**
     * Flushes and closes the exporter. Later calls do nothing.
     */
    public void shutdown() {
        if (tracerProvider != null) {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        }
    }

    /**
     * Where finished spans go.
     */
    public enum Exporter {
        LOGGING,
        OTLP
    }

    /**
     * Tracing settings of a run.
     *
     * @param enabled      whether spans are recorded at all
     * @param exporter     destination of finished spans
     * @param otlpEndpoint collector endpoint, used by {@link Exporter#OTLP}
     * @param serviceName  {@code service.name} resource attribute
     */
    public record Settings(boolean enabled, Exporter exporter, String otlpEndpoint, String serviceName) {

        public static Settings disabled() {
            return new Settings(false, Exporter.LOGGING, DEFAULT_OTLP_ENDPOINT, DEFAULT_SERVICE_NAME);
        }

        /**
         * Reads {@code OTEL_DISABLED} (default true), {@code OTEL_EXPORTER_TYPE} (logging or
         * otlp), {@code OTEL_EXPORTER_OTLP_ENDPOINT} and {@code SERVICE_NAME}. An environment
         * variable wins over the system property of the same name. An unknown exporter type
         * falls back to logging.
         */
        public static Settings fromEnvironment() {
            boolean enabled = !Boolean.parseBoolean(setting("OTEL_DISABLED", "true"));
            String type = setting("OTEL_EXPORTER_TYPE", "logging").toUpperCase(Locale.ROOT);
            Exporter exporter;
            try {
                exporter = Exporter.valueOf(type);
            } catch (IllegalArgumentException e) {
                logger.warning("Unknown OTEL_EXPORTER_TYPE '" + type + "', spans will be logged");
                exporter = Exporter.LOGGING;
            }
            return new Settings(enabled, exporter,
                    setting("OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_OTLP_ENDPOINT),
                    setting("SERVICE_NAME", DEFAULT_SERVICE_NAME));
        }

        private static String setting(String name, String defaultValue) {
            String value = System.getenv(name);
            if (value == null || value.isEmpty()) {
                value = System.getProperty(name);
            }
            return value == null || value.isEmpty() ? defaultValue : value;
        }
    }
}
