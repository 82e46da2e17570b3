package me.golemcore.streamchat.domain.model;

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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-flight state of one conversational turn.
 *
 * <p>
 * Buffers are written only by the request's own orchestration task. The state,
 * the stop flag, and the abort hooks are shared with external cancel/stop calls
 * and are therefore atomic or volatile.
 */
@Getter
@Slf4j
public class StreamingRequest {

    private final String requestId;
    private final String chatId;
    private final String model;
    private final Instant createdAt;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.CREATED);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    @Getter(lombok.AccessLevel.NONE)
    private final StringBuilder textBuffer = new StringBuilder();
    @Getter(lombok.AccessLevel.NONE)
    private final StringBuilder thinkingBuffer = new StringBuilder();
    private Instant thinkingStartedAt;
    private boolean thinking;
    private Double thinkingDurationSeconds;

    private int toolRounds;
    private final List<String> persistedMessageIds = new ArrayList<>();

    private volatile Closeable activeSource;
    private volatile Future<?> pendingTool;
    private volatile Future<?> task;

    @Getter(lombok.AccessLevel.NONE)
    private final Object eventLock = new Object();

    public StreamingRequest(String requestId, String chatId, String model, Instant createdAt) {
        this.requestId = requestId;
        this.chatId = chatId;
        this.model = model;
        this.createdAt = createdAt;
    }

    // ==================== STATE ====================

    public RequestState getState() {
        return state.get();
    }

    /**
     * Moves a live request back to {@link RequestState#STREAMING} or into
     * {@link RequestState#TOOL_PENDING}. Fails once the request is terminal.
     */
    public boolean moveTo(RequestState next) {
        while (true) {
            RequestState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * Claims the terminal transition. Only the first caller wins.
     */
    public boolean terminate(RequestState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        return moveTo(terminal);
    }

    public boolean isFinished() {
        return state.get().isTerminal();
    }

    public boolean isCancelled() {
        return state.get() == RequestState.CANCELLED;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    // ==================== BUFFERS ====================

    public void appendText(String text) {
        textBuffer.append(text);
    }

    public String getText() {
        return textBuffer.toString();
    }

    public boolean hasText() {
        return !textBuffer.isEmpty();
    }

    public String drainText() {
        String text = textBuffer.toString();
        textBuffer.setLength(0);
        return text;
    }

    public void startThinking(Instant now) {
        thinking = true;
        thinkingStartedAt = now;
    }

    public void appendThinking(String text) {
        thinkingBuffer.append(text);
    }

    /**
     * Ends the thinking phase and returns its duration in seconds. Durations of
     * several phases before the same saved message add up.
     */
    public double finishThinking(Instant now) {
        thinking = false;
        double seconds = thinkingStartedAt == null
                ? 0.0
                : Math.max(0L, now.toEpochMilli() - thinkingStartedAt.toEpochMilli()) / 1000.0;
        thinkingDurationSeconds = (thinkingDurationSeconds != null ? thinkingDurationSeconds : 0.0) + seconds;
        return seconds;
    }

    public String getThoughts() {
        return thinkingBuffer.toString();
    }

    public ThoughtsStatus getThoughtsStatus() {
        if (thinkingDurationSeconds == null) {
            return ThoughtsStatus.NONE;
        }
        return thinkingBuffer.isEmpty() ? ThoughtsStatus.UNAVAILABLE : ThoughtsStatus.PRESENT;
    }

    /**
     * Forgets thinking that has been attached to a saved message.
     */
    public void clearThoughts() {
        thinkingBuffer.setLength(0);
        thinkingStartedAt = null;
        thinkingDurationSeconds = null;
    }

    public int incrementToolRounds() {
        return ++toolRounds;
    }

    public void recordPersisted(String messageId) {
        persistedMessageIds.add(messageId);
    }

    public boolean hasPersistedMessages() {
        return !persistedMessageIds.isEmpty();
    }

    /**
     * Lock that orders event emission against the terminal transition.
     */
    public Object eventLock() {
        return eventLock;
    }

    // ==================== ABORT HOOKS ====================

    /**
     * Registers what a cancel or stop closes to unblock the task. Closed at once
     * if the request was already cancelled or stopped.
     */
    public void attachSource(Closeable source) {
        this.activeSource = source;
        if (isFinished() || isStopRequested()) {
            closeQuietly(source);
        }
    }

    public void detachSource() {
        this.activeSource = null;
    }

    public void attachPendingTool(Future<?> future) {
        this.pendingTool = future;
    }

    public void detachPendingTool() {
        this.pendingTool = null;
    }

    public void attachTask(Future<?> future) {
        this.task = future;
    }

    /**
     * Interrupts whatever the task is waiting on: the network read, the tool
     * result, or both.
     */
    public void abort(boolean interruptTask) {
        Closeable source = activeSource;
        if (source != null) {
            closeQuietly(source);
        }
        Future<?> tool = pendingTool;
        if (tool != null) {
            tool.cancel(true);
        }
        Future<?> running = task;
        if (interruptTask && running != null) {
            running.cancel(true);
        }
    }

    private void closeQuietly(Closeable source) {
        try {
            source.close();
        } catch (IOException e) {
            log.debug("[Stream] Failed to close source for request {}: {}", requestId, e.getMessage());
        }
    }
}
