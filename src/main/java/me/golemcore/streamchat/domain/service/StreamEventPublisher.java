package me.golemcore.streamchat.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.model.StreamEvent;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans stream events out to subscribers without ever blocking the request task
 * that produces them.
 *
 * <p>
 * Each request gets its own replaying sink, so a subscriber that attaches late
 * still sees the whole turn in order; the sink completes after the terminal
 * event. Finished request sinks are retained for a while. A shared sink
 * replays the most recent events of all requests.
 *
 * <p>
 * Every returned flux buffers per subscriber and delivers on its own worker,
 * so emitting only enqueues and a slow subscriber holds up nobody else.
 */
@Component
@Slf4j
public class StreamEventPublisher {

    private static final Duration EMIT_RETRY = Duration.ofMillis(100);

    private final Sinks.Many<StreamEvent> allEvents;
    private final Scheduler deliveryScheduler = Schedulers.boundedElastic();
    private final Map<String, Sinks.Many<StreamEvent>> active = new ConcurrentHashMap<>();
    private final Map<String, Sinks.Many<StreamEvent>> finished;

    public StreamEventPublisher(StreamChatProperties properties) {
        this.allEvents = Sinks.many().replay().limit(Math.max(1, properties.getEvents().getHistorySize()));
        int retained = Math.max(0, properties.getEvents().getRetainedRequests());
        this.finished = new LinkedHashMap<>() {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Sinks.Many<StreamEvent>> eldest) {
                return size() > retained;
            }
        };
    }

    /**
     * Creates the event channel of a new request.
     */
    public void open(String requestId) {
        active.put(requestId, Sinks.many().replay().all());
    }

    /**
     * Publishes an event. Callers serialize events of the same request.
     */
    public void publish(StreamEvent event) {
        Sinks.Many<StreamEvent> sink = active.get(event.requestId());
        if (sink != null) {
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure()) {
                log.warn("[Events] Failed to emit {} for request {}: {}", event.getClass().getSimpleName(),
                        event.requestId(), result);
            }
        }
        allEvents.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
    }

    /**
     * Completes the request's channel after its terminal event.
     */
    public void close(String requestId) {
        Sinks.Many<StreamEvent> sink = active.get(requestId);
        if (sink == null) {
            return;
        }
        sink.tryEmitComplete();
        synchronized (finished) {
            finished.put(requestId, sink);
        }
        active.remove(requestId);
    }

    /**
     * Events of every request. New subscribers first receive the most recent
     * history.
     */
    public Flux<StreamEvent> events() {
        return decouple(allEvents);
    }

    /**
     * All events of one request from its start, completing after the terminal
     * event. Empty for unknown or long-finished requests.
     */
    public Flux<StreamEvent> events(String requestId) {
        Sinks.Many<StreamEvent> sink = active.get(requestId);
        if (sink == null) {
            synchronized (finished) {
                sink = finished.get(requestId);
            }
        }
        return sink != null ? decouple(sink) : Flux.empty();
    }

    public Flux<StreamEvent> eventsForChat(String chatId) {
        return events().filter(event -> chatId.equals(event.chatId()));
    }

    private Flux<StreamEvent> decouple(Sinks.Many<StreamEvent> sink) {
        return sink.asFlux()
                .onBackpressureBuffer()
                .publishOn(deliveryScheduler);
    }
}
