/*
 * /////////////////////////////////////////////////////////////////////////////
 *
 * Copyright (c) 2026 Indra Sistemas, S.A. All Rights Reserved.
 * http://www.indracompany.com/
 *
 * The contents of this file are owned by Indra Sistemas, S.A. copyright holder.
 * This file can only be copied, distributed and used all or in part with the
 * written permission of Indra Sistemas, S.A, or in accordance with the terms and
 * conditions laid down in the agreement / contract under which supplied.
 *
 * /////////////////////////////////////////////////////////////////////////////
 */
package com.indra.minsait.dvsmart.faceindex.support;

import com.indra.minsait.dvsmart.faceindex.application.port.out.EmbeddingProducer;
import com.indra.minsait.dvsmart.faceindex.domain.exception.EmbeddingProducerException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Motor de caras determinista: las caras de cada imagen se registran por su
 * contenido textual. Una imagen sin registrar no tiene caras.
 */
public class FakeEmbeddingProducer implements EmbeddingProducer {

    private final Map<String, List<float[]>> facesByContent = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Consumer<String> onCall = content -> { };

    public FakeEmbeddingProducer faces(String content, float[]... vectors) {
        facesByContent.put(content, List.of(vectors));
        return this;
    }

    public void failOn(String content) {
        failing.add(content);
    }

    public void recover(String content) {
        failing.remove(content);
    }

    public void delayOn(String content, Duration delay) {
        delays.put(content, delay);
    }

    /**
     * Se ejecuta al inicio de cada llamada con el contenido de la imagen.
     */
    public void onCall(Consumer<String> hook) {
        this.onCall = hook;
    }

    public int callCount() {
        return calls.get();
    }

    @Override
    public List<float[]> detectAndEmbed(byte[] imageBytes) {
        calls.incrementAndGet();
        String content = new String(imageBytes, StandardCharsets.UTF_8);
        onCall.accept(content);

        Duration delay = delays.get(content);
        if (delay != null) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingProducerException("Interrupted while processing " + content, e);
            }
        }
        if (failing.contains(content)) {
            throw new EmbeddingProducerException("Engine error on " + content);
        }
        return facesByContent.getOrDefault(content, List.of());
    }

    @Override
    public String modelVersion() {
        return "fake-512";
    }
}
