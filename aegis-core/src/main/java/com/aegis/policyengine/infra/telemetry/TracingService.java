package com.aegis.policyengine.infra.telemetry;

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
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry bootstrap for the policy engine.
 *
 * Configuration via environment variables (system properties of the same name also work):
 * - OTEL_DISABLED: Disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)
 * - SERVICE_NAME: Service identifier (default: aegis-policy-engine)
 *
 * The logging exporter exports synchronously; OTLP export is batched.
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.aegis.policy-engine";
    private static final String DEFAULT_SERVICE_NAME = "aegis-policy-engine";
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private static volatile TracingService instance;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    /**
     * Process-wide instance configured from the environment, created on first use.
     */
    public static TracingService getInstance() {
        TracingService result = instance;
        if (result == null) {
            synchronized (LOCK) {
                result = instance;
                if (result == null) {
                    result = create(TracingService::getEnvOrProperty);
                    if (result.isEnabled()) {
                        TracingService shutdownTarget = result;
                        Runtime.getRuntime().addShutdownHook(
                                new Thread(shutdownTarget::shutdown, "otel-shutdown-hook"));
                    }
                    instance = result;
                }
            }
        }
        return result;
    }

    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    /**
     * Builds a service from a settings lookup; a {@code null} lookup result means unset.
     */
    static TracingService create(UnaryOperator<String> settings) {
        if (Boolean.parseBoolean(setting(settings, "OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }
        try {
            String serviceName = setting(settings, "SERVICE_NAME", DEFAULT_SERVICE_NAME);
            Resource resource = Resource.getDefault()
                    .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(configureSampler(settings))
                    .addSpanProcessor(configureProcessor(settings))
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s", serviceName));
            return new TracingService(sdk, tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Sampler configureSampler(UnaryOperator<String> settings) {
        double ratio;
        try {
            ratio = Double.parseDouble(setting(settings, "OTEL_TRACE_SAMPLING_RATIO", "1.0"));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, sampling everything");
            ratio = 1.0;
        }
        return Sampler.parentBased(Sampler.traceIdRatioBased(Math.max(0.0, Math.min(1.0, ratio))));
    }

    private static SpanProcessor configureProcessor(UnaryOperator<String> settings) {
        String exporterType = setting(settings, "OTEL_EXPORTER_TYPE", "logging").toLowerCase();
        if ("otlp".equals(exporterType)) {
            String endpoint = setting(settings, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            SpanExporter exporter = OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
            return BatchSpanProcessor.builder(exporter)
                    .setScheduleDelay(Duration.ofSeconds(5))
                    .build();
        }
        if (!"logging".equals(exporterType)) {
            logger.warning("Unknown exporter type: " + exporterType + ", using logging");
        }
        return SimpleSpanProcessor.create(LoggingSpanExporter.create());
    }

    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String setting(UnaryOperator<String> settings, String key, String defaultValue) {
        String value = settings.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static String getEnvOrProperty(String key) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? System.getProperty(key) : value;
    }
}
