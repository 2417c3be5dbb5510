package com.example.intent.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

@Component
public class IntentMetrics {

    private final LongCounter classificationCount;
    private final DoubleHistogram topConfidence;
    private final LongCounter fallbackCount;
    private final LongCounter misclassificationCount;
    private final LongCounter reasoningCount;
    private final LongCounter detectionCount;
    private final DoubleHistogram resolutionDuration;

    public IntentMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter("intent-resolution");

        this.classificationCount = meter.counterBuilder("intent.classification.count")
            .setDescription("Number of classifications by recommended action")
            .build();

        this.topConfidence = meter.histogramBuilder("intent.classification.confidence")
            .setDescription("Confidence of the top candidate intent")
            .build();

        this.fallbackCount = meter.counterBuilder("intent.fallback.count")
            .setDescription("Number of fallback escalations by level reached")
            .build();

        this.misclassificationCount = meter.counterBuilder("intent.misclassification.count")
            .setDescription("Number of recorded misclassifications")
            .build();

        this.reasoningCount = meter.counterBuilder("intent.reasoning.count")
            .setDescription("Number of chain-of-thought runs by outcome")
            .build();

        this.detectionCount = meter.counterBuilder("intent.detection.count")
            .setDescription("Number of model-based detections by mode")
            .build();

        this.resolutionDuration = meter.histogramBuilder("intent.resolution.duration")
            .setUnit("s")
            .setDescription("Duration of end-to-end intent resolution")
            .build();
    }

    public void recordClassification(String action, String intent, double confidence, boolean withContext) {
        classificationCount.add(1, Attributes.of(
            AttributeKey.stringKey("intent.recommended_action"), action,
            AttributeKey.booleanKey("intent.with_context"), withContext
        ));
        topConfidence.record(confidence, Attributes.of(
            AttributeKey.stringKey("intent.name"), intent
        ));
    }

    public void recordFallback(String level, boolean successful) {
        fallbackCount.add(1, Attributes.of(
            AttributeKey.stringKey("intent.fallback_level"), level,
            AttributeKey.booleanKey("intent.fallback_successful"), successful
        ));
    }

    public void recordMisclassification(String level, String intent) {
        misclassificationCount.add(1, Attributes.of(
            AttributeKey.stringKey("intent.fallback_level"), level,
            AttributeKey.stringKey("intent.name"), intent
        ));
    }

    public void recordReasoning(boolean verified, boolean error) {
        reasoningCount.add(1, Attributes.of(
            AttributeKey.booleanKey("intent.reasoning_verified"), verified,
            AttributeKey.booleanKey("intent.reasoning_error"), error
        ));
    }

    public void recordDetection(String mode, String intent, boolean escalated) {
        detectionCount.add(1, Attributes.of(
            AttributeKey.stringKey("intent.detection_mode"), mode,
            AttributeKey.stringKey("intent.name"), intent,
            AttributeKey.booleanKey("intent.escalated"), escalated
        ));
    }

    public void recordResolutionDuration(double seconds, String intent, boolean escalated) {
        resolutionDuration.record(seconds, Attributes.of(
            AttributeKey.stringKey("intent.name"), intent,
            AttributeKey.booleanKey("intent.escalated"), escalated
        ));
    }
}
