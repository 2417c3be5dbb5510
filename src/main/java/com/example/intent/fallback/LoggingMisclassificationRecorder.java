package com.example.intent.fallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.intent.model.MisclassificationData;
import com.example.intent.telemetry.IntentMetrics;

import reactor.core.publisher.Mono;

@Component
public class LoggingMisclassificationRecorder implements MisclassificationRecorder {

    private static final Logger log = LoggerFactory.getLogger(LoggingMisclassificationRecorder.class);

    private final IntentMetrics metrics;

    public LoggingMisclassificationRecorder(IntentMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public Mono<Boolean> record(MisclassificationData data) {
        if (data == null) {
            throw new IllegalArgumentException("Misclassification data cannot be null");
        }
        return Mono.fromCallable(() -> {
            log.info("Recorded misclassification {}: query='{}' actual={} expected={} confidence={} fallback={} success={}",
                data.id(), data.originalQuery(), data.actualIntent(), data.expectedIntent(),
                data.confidence(), data.fallbackApplied(), data.fallbackSuccessful());
            metrics.recordMisclassification(data.fallbackApplied().name(),
                data.actualIntent() != null ? data.actualIntent() : "none");
            return true;
        });
    }
}
