package com.seismic.sentinel.monitor.service.streaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SSE hub for dashboard clients.
 * - send(topic, payload): fan-out to every subscriber of the topic.
 * - subscribe(timeoutMs, topics): creates an emitter for the controller.
 *
 * Topics published by the pipeline: "snapshot.published" and "pipeline.state".
 * Single-node only.
 */
@Service
@Slf4j
public class StreamGateway {

    private static final long DEFAULT_TIMEOUT_MS = 30L * 60L * 1000L;  // 30 minutes
    private static final Duration HEARTBEAT_EVERY = Duration.ofSeconds(20);

    @Autowired(required = false)
    @Nullable
    private TaskScheduler taskScheduler;

    private final AtomicBoolean heartbeatScheduled = new AtomicBoolean(false);

    /** Emitter id → emitter */
    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();
    /** Emitter id → subscribed topics */
    private final Map<String, Set<String>> emitterTopics = new ConcurrentHashMap<>();

    /** Broadcast a payload to all subscribers of the given topic. */
    public <T> void send(String topic, T payload) {
        if (!StringUtils.hasText(topic) || emitters.isEmpty()) return;

        List<String> targets = new ArrayList<>();
        emitterTopics.forEach((id, topics) -> {
            if (topics.contains(topic)) targets.add(id);
        });

        for (String id : targets) {
            SseEmitter em = emitters.get(id);
            if (em == null) continue;
            try {
                em.send(SseEmitter.event().name(topic).data(payload));
            } catch (IOException | IllegalStateException ex) {
                log.debug("SSE send failed; pruning emitter {}", id, ex);
                removeEmitter(id);
            }
        }
    }

    /**
     * @param timeoutMs null or <=0 uses the default (30m)
     * @param topics    exact topic names
     */
    public SseEmitter subscribe(@Nullable Long timeoutMs, Collection<String> topics) {
        final long to = (timeoutMs == null || timeoutMs <= 0) ? DEFAULT_TIMEOUT_MS : timeoutMs;
        final SseEmitter emitter = newEmitter(to);
        final String id = UUID.randomUUID().toString();

        Set<String> subs = new LinkedHashSet<>();
        if (topics != null) {
            for (String t : topics) {
                if (StringUtils.hasText(t)) subs.add(t.trim());
            }
        }
        emitters.put(id, emitter);
        emitterTopics.put(id, subs);

        emitter.onCompletion(() -> removeEmitter(id));
        emitter.onTimeout(() -> removeEmitter(id));
        emitter.onError(e -> removeEmitter(id));

        try {
            emitter.send(SseEmitter.event().name("init").data("ok"));
        } catch (IOException ex) {
            log.debug("SSE init failed for {}", id, ex);
            removeEmitter(id);
        }

        startHeartbeatIfNeeded();
        return emitter;
    }

    public int subscriberCount() {
        return emitters.size();
    }

    protected SseEmitter newEmitter(long timeoutMs) {
        return new SseEmitter(timeoutMs);
    }

    private void removeEmitter(String id) {
        emitterTopics.remove(id);
        SseEmitter em = emitters.remove(id);
        if (em != null) {
            try {
                em.complete();
            } catch (IllegalStateException ex) {
                log.debug("Emitter {} already completed", id);
            }
        }
    }

    private void startHeartbeatIfNeeded() {
        if (taskScheduler == null) return;
        if (heartbeatScheduled.compareAndSet(false, true)) {
            taskScheduler.scheduleAtFixedRate(() -> {
                for (Map.Entry<String, SseEmitter> e : emitters.entrySet()) {
                    try {
                        e.getValue().send(SseEmitter.event().name("heartbeat").data("ping"));
                    } catch (IOException | IllegalStateException ex) {
                        removeEmitter(e.getKey());
                    }
                }
            }, HEARTBEAT_EVERY);
            log.info("SSE heartbeat every {}s", HEARTBEAT_EVERY.getSeconds());
        }
    }
}
