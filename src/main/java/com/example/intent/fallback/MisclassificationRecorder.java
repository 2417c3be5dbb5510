package com.example.intent.fallback;

import com.example.intent.model.MisclassificationData;

import reactor.core.publisher.Mono;

/**
 * Sink for escalation audit records.
 */
public interface MisclassificationRecorder {

    /**
     * Emits whether the record was accepted.
     */
    Mono<Boolean> record(MisclassificationData data);
}
