package io.github.hide212131.langchain4j.formagent.runtime.observability;

import io.github.hide212131.langchain4j.formagent.runtime.agent.ObservabilitySink;
import io.github.hide212131.langchain4j.formagent.runtime.agent.RunEvent;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskOutput;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporterBuilder;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Map;
import java.util.Objects;

/**
 * Exports each run as an {@code agent-call} span with a nested {@code llm-call} span over OTLP. Failed runs get
 * an ERROR status and the recorded exception.
 */
@SuppressWarnings("PMD.CloseResource")
public final class OtlpObservabilitySink implements ObservabilitySink, AutoCloseable {

    static final int INSTRUCTIONS_PREVIEW_LENGTH = 500;

    private static final String INSTRUMENTATION_NAME = "langchain4j-form-agent";

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    public OtlpObservabilitySink(String endpoint, Map<String, String> headers) {
        this(buildExporter(endpoint, headers));
    }

    OtlpObservabilitySink(SpanExporter exporter) {
        Objects.requireNonNull(exporter, "exporter");
        tracerProvider = SdkTracerProvider.builder()
                .setResource(Resource.create(
                        Attributes.of(AttributeKey.stringKey("service.name"), "langchain4j-form-agent")))
                .addSpanProcessor(SimpleSpanProcessor.create(exporter)).build();
        openTelemetry = OpenTelemetrySdk.builder().setTracerProvider(tracerProvider).build();
        tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    @Override
    public void record(RunEvent event) {
        Objects.requireNonNull(event, "event");
        Span agentSpan = tracer.spanBuilder("agent-call").setSpanKind(SpanKind.INTERNAL)
                .setAttribute("agent.run_id", safe(event.runId()))
                .setAttribute("agent.instructions", preview(event.definition().instructions()))
                .setAttribute("agent.input.text", event.input().text())
                .setAttribute("agent.input.context", event.input().context().toString())
                .setAttribute("agent.duration_ms", event.durationMs())
                .setAttribute("agent.resource_id", safe(event.resourceId()))
                .startSpan();
        try {
            Span llmSpan = tracer.spanBuilder("llm-call").setSpanKind(SpanKind.CLIENT)
                    .setParent(Context.current().with(agentSpan))
                    .setAttribute("gen_ai.request.prompt", event.input().text())
                    .startSpan();
            try {
                if (event.succeeded()) {
                    applyOutput(agentSpan, event.output());
                    applyOutput(llmSpan, event.output());
                    agentSpan.setStatus(StatusCode.OK);
                    llmSpan.setStatus(StatusCode.OK);
                } else {
                    applyError(agentSpan, event.error());
                    applyError(llmSpan, event.error());
                }
            } finally {
                llmSpan.end();
            }
        } finally {
            agentSpan.end();
        }
    }

    @Override
    public void close() {
        tracerProvider.close();
    }

    private void applyOutput(Span span, TaskOutput output) {
        span.setAttribute("agent.output.text", output.text());
        span.setAttribute("gen_ai.response.text", output.text());
        Object model = output.metadata().get("model");
        if (model != null) {
            span.setAttribute("gen_ai.request.model", model.toString());
        }
        if (output.metadata().get(TaskOutput.TOKENS) instanceof Map<?, ?> tokens) {
            setLong(span, "gen_ai.usage.input_tokens", tokens.get("input"));
            setLong(span, "gen_ai.usage.output_tokens", tokens.get("output"));
        }
    }

    private void applyError(Span span, Throwable error) {
        span.setStatus(StatusCode.ERROR, safe(error.getMessage()));
        span.setAttribute("agent.error.type", error.getClass().getSimpleName());
        span.setAttribute("agent.error.message", safe(error.getMessage()));
        span.recordException(error);
    }

    private static void setLong(Span span, String key, Object value) {
        if (value instanceof Number number) {
            span.setAttribute(key, number.longValue());
        }
    }

    static String preview(String instructions) {
        if (instructions.length() <= INSTRUCTIONS_PREVIEW_LENGTH) {
            return instructions;
        }
        return instructions.substring(0, INSTRUCTIONS_PREVIEW_LENGTH);
    }

    private static SpanExporter buildExporter(String endpoint, Map<String, String> headers) {
        OtlpGrpcSpanExporterBuilder builder = OtlpGrpcSpanExporter.builder();
        if (endpoint != null && !endpoint.isBlank()) {
            builder.setEndpoint(endpoint);
        }
        if (headers != null) {
            headers.forEach(builder::addHeader);
        }
        return builder.build();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
