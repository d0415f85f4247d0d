/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry setup for the rules engine.
 *
 * <p>Spans are exported asynchronously in batches, so evaluation never waits on the
 * exporter. When tracing is disabled or the SDK cannot be built, a no-op tracer is
 * handed out instead.
 *
 * <p>Configuration via environment variables (system properties with the same name
 * are used when the variable is unset):
 * <ul>
 *   <li>{@code OTEL_DISABLED}: disable tracing entirely (default: false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: logging|otlp (default: logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default depends on environment)</li>
 *   <li>{@code SERVICE_NAME}: service identifier (default: agent-rules)</li>
 *   <li>{@code SERVICE_VERSION}: deployment version (default: unknown)</li>
 *   <li>{@code DEPLOYMENT_ENVIRONMENT}: prod|staging|dev (default: dev)</li>
 * </ul>
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.helios.agent-rules";
    private static final String DEFAULT_SERVICE_NAME = "agent-rules";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer,
                           SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;
    }

    /**
     * Process-wide instance configured from the environment. The SDK is registered
     * globally and flushed by a shutdown hook.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize(TracingService::getEnvOrProperty, true);
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Builds a standalone instance from the given settings lookup. Nothing is
     * registered globally; the caller owns {@link #shutdown()}.
     *
     * @param settings maps a setting name to its value, or null when unset
     */
    public static TracingService create(UnaryOperator<String> settings) {
        return initialize(settings, false);
    }

    /**
     * Instance that records nothing.
     */
    public static TracingService noop() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static TracingService initialize(UnaryOperator<String> settings, boolean global) {
        try {
            if (Boolean.parseBoolean(setting(settings, "OTEL_DISABLED", "false"))) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return noop();
            }

            String environment = environment(settings);
            Sampler sampler = configureSampler(settings, environment);
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(buildResource(settings, environment))
                    .setSampler(sampler)
                    .addSpanProcessor(
                            BatchSpanProcessor.builder(configureExporter(settings))
                                    .setMaxQueueSize(2048)
                                    .setMaxExportBatchSize(256)
                                    .setScheduleDelay(Duration.ofSeconds(5))
                                    .setExporterTimeout(Duration.ofSeconds(30))
                                    .build()
                    )
                    .build();

            OpenTelemetrySdk sdk = global
                    ? OpenTelemetrySdk.builder()
                        .setTracerProvider(tracerProvider)
                        .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                        .buildAndRegisterGlobal()
                    : OpenTelemetrySdk.builder()
                        .setTracerProvider(tracerProvider)
                        .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                        .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, env=%s, sampler=%s",
                    serviceName(settings), environment, sampler.getDescription()));

            TracingService service = new TracingService(
                    sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);
            if (global) {
                service.registerShutdownHook();
            }
            return service;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Resource buildResource(UnaryOperator<String> settings, String environment) {
        return Resource.getDefault().merge(Resource.create(Attributes.builder()
                .put(SERVICE_NAME, serviceName(settings))
                .put(SERVICE_VERSION, setting(settings, "SERVICE_VERSION", "unknown"))
                .put(DEPLOYMENT_ENVIRONMENT, environment)
                .build()));
    }

    private static Sampler configureSampler(UnaryOperator<String> settings, String environment) {
        String defaultRatio = switch (environment.toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };
        String ratioValue = setting(settings, "OTEL_TRACE_SAMPLING_RATIO", defaultRatio);

        double ratio;
        try {
            ratio = Math.max(0.0, Math.min(1.0, Double.parseDouble(ratioValue)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO '" + ratioValue + "', using " + defaultRatio);
            ratio = Double.parseDouble(defaultRatio);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter(UnaryOperator<String> settings) {
        String exporterType = setting(settings, "OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = setting(settings, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> {
                logger.info("Using Logging exporter (dev/debug mode)");
                yield LoggingSpanExporter.create();
            }
            default -> {
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                yield LoggingSpanExporter.create();
            }
        };
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down OpenTelemetry...");
            shutdown();
        }, "otel-shutdown-hook"));
    }

    /**
     * Drains buffered spans and stops the exporter.
     */
    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public void flush() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error flushing spans", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static String serviceName(UnaryOperator<String> settings) {
        return setting(settings, "SERVICE_NAME",
                setting(settings, "OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    private static String environment(UnaryOperator<String> settings) {
        return setting(settings, "DEPLOYMENT_ENVIRONMENT", "dev");
    }

    private static String setting(UnaryOperator<String> settings, String key, String defaultValue) {
        String value = settings.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }
}
