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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.streamchat.domain.model.BranchResult;
import me.golemcore.streamchat.domain.model.Message;
import me.golemcore.streamchat.domain.model.NodeUpdate;
import me.golemcore.streamchat.domain.model.RequestState;
import me.golemcore.streamchat.domain.model.StreamEvent;
import me.golemcore.streamchat.domain.model.StreamingRequest;
import me.golemcore.streamchat.domain.model.ToolResult;
import me.golemcore.streamchat.domain.stream.CanonicalEvent;
import me.golemcore.streamchat.domain.stream.EventRouter;
import me.golemcore.streamchat.domain.stream.StreamAction;
import me.golemcore.streamchat.domain.stream.StreamDialect;
import me.golemcore.streamchat.domain.stream.StreamEventHandler;
import me.golemcore.streamchat.domain.stream.StreamResult;
import me.golemcore.streamchat.domain.stream.StreamWireParser;
import me.golemcore.streamchat.domain.stream.ToolCallAssembler;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import me.golemcore.streamchat.port.outbound.LineSource;
import me.golemcore.streamchat.port.outbound.ProviderCall;
import me.golemcore.streamchat.port.outbound.ToolExecutorPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives conversational turns from dispatch to a terminal state.
 *
 * <p>
 * Each request runs as one task on the {@code streamRequestExecutor}:
 * <ol>
 * <li>open the provider stream and feed it through {@link StreamWireParser}
 * and {@link EventRouter}</li>
 * <li>publish text and thinking deltas as they arrive</li>
 * <li>when the response asks for tools: save the text so far, save the call,
 * run the tool, save its result, and stream a continuation</li>
 * <li>save the final answer and publish {@link StreamEvent.Complete}</li>
 * </ol>
 *
 * <p>
 * Only the request's task writes its buffers and saves its messages.
 * {@link #cancel(String)} and {@link #stopAndComplete(String)} may come from
 * any thread; they only flip state and abort the current wait. The terminal
 * transition is claimed with a compare-and-set, so persistence and the terminal
 * event happen at most once per request.
 */
@Service
@Slf4j
public class RequestOrchestrator {

    private static final int LOG_EXCERPT = 200;

    private final InFlightRequestRegistry inFlightRequests;
    private final StreamEventPublisher eventPublisher;
    private final StreamWireParser wireParser;
    private final EventRouter eventRouter;
    private final DialectRegistry dialectRegistry;
    private final ConversationService conversationService;
    private final ToolExecutorPort toolExecutor;
    private final ObjectMapper objectMapper;
    private final StreamChatProperties properties;
    private final ExecutorService executor;
    private final Clock clock;

    @SuppressWarnings("java:S107")
    public RequestOrchestrator(InFlightRequestRegistry inFlightRequests, StreamEventPublisher eventPublisher,
            StreamWireParser wireParser, EventRouter eventRouter, DialectRegistry dialectRegistry,
            ConversationService conversationService, ToolExecutorPort toolExecutor, ObjectMapper objectMapper,
            StreamChatProperties properties, @Qualifier("streamRequestExecutor") ExecutorService executor,
            Clock clock) {
        this.inFlightRequests = inFlightRequests;
        this.eventPublisher = eventPublisher;
        this.wireParser = wireParser;
        this.eventRouter = eventRouter;
        this.dialectRegistry = dialectRegistry;
        this.conversationService = conversationService;
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    // ==================== PUBLIC API ====================

    /**
     * Registers the request and starts streaming it in the background.
     *
     * @param initialMessages
     *            context sent with the first call, normally the flattened active
     *            path of the chat
     * @throws IllegalStateException
     *             if a request with this id is already in flight
     * @throws IllegalArgumentException
     *             if the provider's dialect is unknown
     */
    public StreamingRequest start(String requestId, String chatId, ProviderCall providerCall,
            List<Message> initialMessages) {
        StreamDialect dialect = dialectRegistry.get(providerCall.getDialectId());
        StreamingRequest request = new StreamingRequest(requestId, chatId, providerCall.getModel(), clock.instant());
        if (!inFlightRequests.register(request)) {
            throw new IllegalStateException("Request already in flight: " + requestId);
        }
        eventPublisher.open(requestId);
        log.info("[Stream] Starting request {} in chat {} (dialect {}, model {})", requestId, chatId,
                dialect.getId(), providerCall.getModel());

        List<Message> context = new ArrayList<>(initialMessages != null ? initialMessages : List.of());
        try {
            Future<?> task = executor.submit(() -> run(request, providerCall, dialect, context));
            request.attachTask(task);
        } catch (RejectedExecutionException e) {
            log.error("[Stream] Executor rejected request {}", requestId, e);
            fail(request, "Request could not be scheduled");
        }
        return request;
    }

    /**
     * Aborts the request and discards its unsaved text. Messages saved earlier in
     * the turn are kept. No-op for unknown or finished requests.
     */
    public void cancel(String requestId) {
        StreamingRequest request = inFlightRequests.get(requestId).orElse(null);
        if (request == null) {
            log.debug("[Stream] Cancel of unknown or finished request {} ignored", requestId);
            return;
        }
        synchronized (request.eventLock()) {
            if (!request.terminate(RequestState.CANCELLED)) {
                return;
            }
        }
        inFlightRequests.remove(request);
        request.abort(true);
        emitTerminal(request, new StreamEvent.StatusChange(requestId, request.getChatId(), RequestState.CANCELLED));
        log.info("[Stream] Request {} cancelled", requestId);
    }

    /**
     * Stops reading and completes the turn with the text received so far. The
     * request's own task saves the text and publishes
     * {@link StreamEvent.Complete}.
     */
    public void stopAndComplete(String requestId) {
        StreamingRequest request = inFlightRequests.get(requestId).orElse(null);
        if (request == null) {
            log.debug("[Stream] Stop of unknown or finished request {} ignored", requestId);
            return;
        }
        request.requestStop();
        request.abort(false);
        log.info("[Stream] Stop requested for request {}", requestId);
    }

    public Flux<StreamEvent> events() {
        return eventPublisher.events();
    }

    public Flux<StreamEvent> events(String requestId) {
        return eventPublisher.events(requestId);
    }

    public Flux<StreamEvent> eventsForChat(String chatId) {
        return eventPublisher.eventsForChat(chatId);
    }

    public Collection<StreamingRequest> getActiveRequests() {
        return inFlightRequests.getActive();
    }

    public boolean isChatActive(String chatId) {
        return inFlightRequests.isChatActive(chatId);
    }

    @PreDestroy
    public void shutdown() {
        for (StreamingRequest request : inFlightRequests.getActive()) {
            cancel(request.getRequestId());
        }
    }

    // ==================== REQUEST TASK ====================

    private void run(StreamingRequest request, ProviderCall providerCall, StreamDialect dialect,
            List<Message> context) {
        try {
            while (true) {
                if (request.isStopRequested()) {
                    completeTurn(request);
                    return;
                }
                if (!request.moveTo(RequestState.STREAMING)) {
                    return;
                }
                emit(request, new StreamEvent.StatusChange(request.getRequestId(), request.getChatId(),
                        RequestState.STREAMING));

                RoundOutcome outcome = streamRound(request, providerCall, dialect, context);
                if (request.isFinished()) {
                    return;
                }
                if (request.isStopRequested()) {
                    completeTurn(request);
                    return;
                }
                if (outcome.error() != null) {
                    fail(request, outcome.error());
                    return;
                }
                if (outcome.toolCalls().isEmpty()) {
                    completeTurn(request);
                    return;
                }

                int maxRounds = properties.getTurn().getMaxToolRounds();
                if (request.getToolRounds() >= maxRounds) {
                    fail(request, "Tool call limit reached (" + maxRounds + ")");
                    return;
                }
                request.incrementToolRounds();
                for (Message.ToolCall toolCall : outcome.toolCalls()) {
                    if (!runTool(request, toolCall, context)) {
                        if (request.isStopRequested() && !request.isFinished()) {
                            completeTurn(request);
                        }
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!request.isFinished()) {
                fail(request, "Request interrupted");
            }
        } catch (RuntimeException e) { // NOSONAR - any failure must end the request
            log.error("[Stream] Request {} failed", request.getRequestId(), e);
            fail(request, "Internal error: " + describe(e));
        }
    }

    private RoundOutcome streamRound(StreamingRequest request, ProviderCall providerCall, StreamDialect dialect,
            List<Message> context) {
        ToolCallAssembler assembler = new ToolCallAssembler(objectMapper);
        RoundHandler handler = new RoundHandler(request, dialect, assembler);

        LineSource source;
        try {
            source = providerCall.open(List.copyOf(context), request::attachSource);
        } catch (IOException e) {
            request.detachSource();
            if (request.isFinished() || request.isStopRequested()) {
                return RoundOutcome.aborted();
            }
            return RoundOutcome.failed(describe(e));
        }

        request.attachSource(source);
        try (source) {
            if (request.isFinished() || request.isStopRequested()) {
                return RoundOutcome.aborted();
            }
            StreamResult result = wireParser.parse(source, dialect, handler);
            if (result instanceof StreamResult.Error error) {
                return RoundOutcome.failed(error.message());
            }
            return RoundOutcome.completed(assembler.drain());
        } catch (IOException e) {
            if (request.isFinished() || request.isStopRequested()) {
                return RoundOutcome.aborted();
            }
            return RoundOutcome.failed("Stream interrupted: " + describe(e));
        } finally {
            request.detachSource();
        }
    }

    /**
     * Runs one tool call and saves its result.
     *
     * @return false if the request was cancelled or stopped while waiting
     */
    private boolean runTool(StreamingRequest request, Message.ToolCall toolCall, List<Message> context)
            throws InterruptedException {
        if (request.hasText()) {
            Message text = persist(request, assistantMessage(request, request.drainText()), context);
            if (text == null) {
                return false;
            }
            emit(request, new StreamEvent.MessagesAdded(request.getRequestId(), request.getChatId(),
                    List.of(text.getId())));
        }

        emit(request, new StreamEvent.ToolCallRequest(request.getRequestId(), request.getChatId(),
                toolCall.getName(), toolCall.getId(), toolCall.getArguments()));
        Message.MessageBuilder callBuilder = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL_CALL)
                .toolCall(toolCall)
                .toolName(toolCall.getName())
                .model(request.getModel())
                .timestamp(clock.instant());
        attachThoughts(request, callBuilder);
        Message callMessage = persist(request, callBuilder.build(), context);
        if (callMessage == null) {
            return false;
        }

        if (!request.moveTo(RequestState.TOOL_PENDING)) {
            return false;
        }
        emit(request, new StreamEvent.StatusChange(request.getRequestId(), request.getChatId(),
                RequestState.TOOL_PENDING));

        ToolResult result = awaitTool(request, toolCall);
        if (result == null) {
            if (request.isStopRequested()) {
                persist(request, toolResponse(toolCall, ToolResult.failure("Tool execution stopped")), context);
            }
            return false;
        }

        Message response = persist(request, toolResponse(toolCall, result), context);
        if (response == null) {
            return false;
        }
        emit(request, new StreamEvent.MessagesAdded(request.getRequestId(), request.getChatId(),
                List.of(callMessage.getId(), response.getId())));
        log.debug("[Stream] Tool {} for request {} finished (success={})", toolCall.getName(),
                request.getRequestId(), result.isSuccess());
        return true;
    }

    /**
     * Waits for the tool result.
     *
     * @return the result, or {@code null} if the wait was aborted by cancel/stop
     */
    private ToolResult awaitTool(StreamingRequest request, Message.ToolCall toolCall) throws InterruptedException {
        if (toolCall.hasArgumentsError()) {
            return ToolResult.failure(toolCall.getArgumentsError());
        }

        CompletableFuture<ToolResult> future;
        try {
            future = toolExecutor.execute(toolCall.getName(), toolCall.getArguments());
        } catch (RuntimeException e) {
            log.warn("[Stream] Tool {} could not be started: {}", toolCall.getName(), e.getMessage());
            return ToolResult.failure("Tool " + toolCall.getName() + " failed: " + e.getMessage());
        }

        Duration timeout = properties.getTurn().getToolTimeout();
        request.attachPendingTool(future);
        try {
            if (request.isFinished() || request.isStopRequested()) {
                future.cancel(true);
                return null;
            }
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.failure("Tool " + toolCall.getName() + " returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return ToolResult.failure("Tool " + toolCall.getName() + " timed out after " + timeout.toSeconds() + "s");
        } catch (CancellationException e) {
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ToolResult.failure("Tool " + toolCall.getName() + " failed: " + cause.getMessage());
        } finally {
            request.detachPendingTool();
        }
    }

    // ==================== TERMINAL TRANSITIONS ====================

    private void completeTurn(StreamingRequest request) {
        if (request.isFinished()) {
            return;
        }
        String text = request.drainText();
        if (text.isEmpty() && !request.hasPersistedMessages() && !request.isStopRequested()) {
            fail(request, "Empty response from provider");
            return;
        }
        synchronized (request.eventLock()) {
            if (!text.isEmpty() && persist(request, assistantMessage(request, text), null) == null) {
                return;
            }
            if (!request.terminate(RequestState.COMPLETED)) {
                return;
            }
        }
        inFlightRequests.remove(request);
        emitTerminal(request, new StreamEvent.Complete(request.getRequestId(), request.getChatId(), text,
                request.getModel()));
        log.info("[Stream] Request {} completed ({} chars, {} tool rounds)", request.getRequestId(),
                text.length(), request.getToolRounds());
    }

    private void fail(StreamingRequest request, String message) {
        if (!request.terminate(RequestState.FAILED)) {
            return;
        }
        inFlightRequests.remove(request);
        emitTerminal(request, new StreamEvent.Error(request.getRequestId(), request.getChatId(), message));
        log.warn("[Stream] Request {} failed: {}", request.getRequestId(), message);
    }

    // ==================== EVENTS ====================

    private void emit(StreamingRequest request, StreamEvent event) {
        synchronized (request.eventLock()) {
            if (request.isFinished()) {
                return;
            }
            eventPublisher.publish(event);
        }
    }

    private void emitTerminal(StreamingRequest request, StreamEvent event) {
        synchronized (request.eventLock()) {
            eventPublisher.publish(event);
            eventPublisher.close(request.getRequestId());
        }
    }

    // ==================== PERSISTENCE ====================

    /**
     * Saves a message unless the request already reached a terminal state. The
     * check and the save hold the event lock, which {@link #cancel(String)} takes
     * for its transition.
     *
     * @return the saved message, or {@code null} if the request is finished
     */
    private Message persist(StreamingRequest request, Message message, List<Message> context) {
        synchronized (request.eventLock()) {
            if (request.isFinished()) {
                log.debug("[Stream] Request {} finished, not saving {}", request.getRequestId(), message.getRole());
                return null;
            }
            BranchResult<NodeUpdate> result = conversationService.appendMessage(request.getChatId(), message);
            if (!result.isSuccess()) {
                throw new IllegalStateException("Failed to save message: " + result.describe());
            }
            request.recordPersisted(message.getId());
        }
        if (context != null) {
            context.add(message);
        }
        return message;
    }

    private Message assistantMessage(StreamingRequest request, String text) {
        Message.MessageBuilder builder = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(text)
                .model(request.getModel())
                .timestamp(clock.instant());
        attachThoughts(request, builder);
        return builder.build();
    }

    private Message toolResponse(Message.ToolCall toolCall, ToolResult result) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .content(result.toResponseText())
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .timestamp(clock.instant())
                .build();
    }

    private void attachThoughts(StreamingRequest request, Message.MessageBuilder builder) {
        if (request.isThinking()) {
            request.finishThinking(clock.instant());
        }
        builder.thoughtsStatus(request.getThoughtsStatus());
        if (request.getThinkingDurationSeconds() != null) {
            builder.thinkingDurationSeconds(request.getThinkingDurationSeconds());
            String thoughts = request.getThoughts();
            builder.thoughts(thoughts.isEmpty() ? null : thoughts);
        }
        request.clearThoughts();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // ==================== STREAM HANDLING ====================

    private record RoundOutcome(List<Message.ToolCall> toolCalls, String error) {

        static RoundOutcome completed(List<Message.ToolCall> toolCalls) {
            return new RoundOutcome(toolCalls, null);
        }

        static RoundOutcome failed(String error) {
            return new RoundOutcome(List.of(), error);
        }

        static RoundOutcome aborted() {
            return new RoundOutcome(List.of(), null);
        }
    }

    /**
     * Applies routed events of one stream round to the request.
     */
    private final class RoundHandler implements StreamEventHandler {

        private final StreamingRequest request;
        private final StreamDialect dialect;
        private final ToolCallAssembler assembler;

        private RoundHandler(StreamingRequest request, StreamDialect dialect, ToolCallAssembler assembler) {
            this.request = request;
            this.dialect = dialect;
            this.assembler = assembler;
        }

        @Override
        public StreamAction onEvent(String eventType, JsonNode payload) {
            if (request.isFinished() || request.isStopRequested()) {
                return StreamAction.STOP;
            }
            for (CanonicalEvent event : eventRouter.classify(dialect, eventType, payload)) {
                StreamAction action = apply(event);
                if (!(action instanceof StreamAction.Continue)) {
                    return action;
                }
            }
            return StreamAction.CONTINUE;
        }

        @Override
        public void onStreamEnd() {
            finishThinking();
        }

        @Override
        public void onParseError(String rawContent, Exception error) {
            String excerpt = rawContent.length() > LOG_EXCERPT ? rawContent.substring(0, LOG_EXCERPT) + "..."
                    : rawContent;
            log.warn("[Stream] Skipping malformed data line in request {}: {} ({})", request.getRequestId(),
                    excerpt, error.getMessage());
        }

        private StreamAction apply(CanonicalEvent event) {
            if (event instanceof CanonicalEvent.TextDelta delta) {
                finishThinking();
                request.appendText(delta.text());
                emit(request, new StreamEvent.PartialResponse(request.getRequestId(), request.getChatId(),
                        delta.text()));
            } else if (event instanceof CanonicalEvent.ThinkingStarted) {
                startThinking();
            } else if (event instanceof CanonicalEvent.ThinkingDelta delta) {
                startThinking();
                request.appendThinking(delta.text());
                emit(request, new StreamEvent.ThinkingPartial(request.getRequestId(), request.getChatId(),
                        delta.text()));
            } else if (event instanceof CanonicalEvent.ThinkingFinished) {
                finishThinking();
            } else if (event instanceof CanonicalEvent.ToolCallRequested requested) {
                finishThinking();
                assembler.add(requested);
            } else if (event instanceof CanonicalEvent.ToolCallFragment fragment) {
                finishThinking();
                assembler.add(fragment);
            } else if (event instanceof CanonicalEvent.ToolCallsFinished) {
                assembler.finishFragments();
            } else if (event instanceof CanonicalEvent.Completed) {
                return StreamAction.STOP;
            } else if (event instanceof CanonicalEvent.Failed failed) {
                return StreamAction.error(failed.message());
            }
            return StreamAction.CONTINUE;
        }

        private void startThinking() {
            if (request.isThinking()) {
                return;
            }
            request.startThinking(clock.instant());
            emit(request, new StreamEvent.ThinkingStarted(request.getRequestId(), request.getChatId()));
        }

        private void finishThinking() {
            if (!request.isThinking()) {
                return;
            }
            double seconds = request.finishThinking(clock.instant());
            emit(request, new StreamEvent.ThinkingComplete(request.getRequestId(), request.getChatId(), seconds,
                    request.getThoughtsStatus()));
        }
    }
}
