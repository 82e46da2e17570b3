package me.golemcore.streamchat.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.streamchat.domain.model.Message;
import me.golemcore.streamchat.domain.model.RequestState;
import me.golemcore.streamchat.domain.model.StreamEvent;
import me.golemcore.streamchat.domain.model.StreamingRequest;
import me.golemcore.streamchat.domain.model.ThoughtsStatus;
import me.golemcore.streamchat.domain.model.ToolResult;
import me.golemcore.streamchat.domain.stream.EventRouter;
import me.golemcore.streamchat.domain.stream.ReaderLineSource;
import me.golemcore.streamchat.domain.stream.StreamWireParser;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import me.golemcore.streamchat.port.outbound.LineSource;
import me.golemcore.streamchat.port.outbound.ProviderCall;
import me.golemcore.streamchat.port.outbound.StoragePort;
import me.golemcore.streamchat.port.outbound.ToolExecutorPort;
import me.golemcore.streamchat.testsupport.InMemoryConversationPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RequestOrchestratorTest {

    private static final String CHAT_ID = "chat-1";
    private static final String MODEL = "test-model";
    private static final String DIALECT = "generic-delta";
    private static final Duration WAIT = Duration.ofSeconds(10);

    private static final String TOOL_ROUND = """
            data: {"type":"delta","content":"Let me check"}
            data: {"type":"tool_call","id":"call_1","name":"clock","arguments":{"timezone":"UTC"}}
            data: {"type":"done"}
            """;

    private StreamChatProperties properties;
    private InMemoryConversationPort conversationPort;
    private ConversationService conversationService;
    private InFlightRequestRegistry inFlightRequests;
    private ExecutorService executor;
    private ToolExecutorPort toolExecutor;
    private final List<String> executedTools = new CopyOnWriteArrayList<>();
    private RequestOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new StreamChatProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

        StoragePort storagePort = mock(StoragePort.class);
        when(storagePort.exists(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(false));
        DialectRegistry dialectRegistry = new DialectRegistry(storagePort, properties, objectMapper);
        dialectRegistry.init();

        conversationPort = new InMemoryConversationPort();
        inFlightRequests = new InFlightRequestRegistry();
        conversationService = new ConversationService(conversationPort, new BranchingStore(), inFlightRequests,
                clock);
        executor = Executors.newCachedThreadPool();
        toolExecutor = (toolId, parameters) -> {
            executedTools.add(toolId);
            return CompletableFuture.completedFuture(ToolResult.success("12:00 UTC"));
        };

        orchestrator = newOrchestrator(objectMapper, dialectRegistry, clock);
    }

    private RequestOrchestrator newOrchestrator(ObjectMapper objectMapper, DialectRegistry dialectRegistry,
            Clock clock) {
        ToolExecutorPort delegatingExecutor = (toolId, parameters) -> toolExecutor.execute(toolId, parameters);
        return new RequestOrchestrator(inFlightRequests, new StreamEventPublisher(properties),
                new StreamWireParser(objectMapper), new EventRouter(), dialectRegistry, conversationService,
                delegatingExecutor, objectMapper, properties, executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ==================== HELPERS ====================

    private List<Message> seedUserMessage(String text) {
        conversationService.appendMessage(CHAT_ID, Message.builder()
                .id("u1")
                .role(Message.ROLE_USER)
                .content(text)
                .build()).getOrThrow();
        return conversationService.getActiveMessages(CHAT_ID);
    }

    private List<StreamEvent> awaitEvents(String requestId) {
        List<StreamEvent> events = orchestrator.events(requestId).collectList().block(WAIT);
        assertNotNull(events);
        return events;
    }

    private <T extends StreamEvent> T awaitFirst(String requestId, Class<T> type) {
        StreamEvent event = orchestrator.events(requestId).filter(type::isInstance).blockFirst(WAIT);
        assertNotNull(event, "expected " + type.getSimpleName());
        return type.cast(event);
    }

    private static List<String> kinds(List<StreamEvent> events) {
        return events.stream().map(event -> event.getClass().getSimpleName()).toList();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long terminalCount(List<StreamEvent> events) {
        return events.stream().filter(StreamEvent::isTerminal).count();
    }

    private List<String> persistedRoles() {
        return conversationService.getActiveMessages(CHAT_ID).stream().map(Message::getRole).toList();
    }

    private List<Message> persisted() {
        return conversationService.getActiveMessages(CHAT_ID);
    }

    // ==================== HAPPY PATHS ====================

    @Test
    void shouldStreamTextAndPersistAssistantMessage() {
        ScriptedProviderCall provider = new ScriptedProviderCall()
                .respond("data: {\"type\":\"delta\",\"content\":\"Hi\"}\ndata: {\"type\":\"delta\",\"content\":\" there\"}\ndata: [DONE]\n");

        orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Hello"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(List.of("StatusChange", "PartialResponse", "PartialResponse", "Complete"), kinds(events));
        StreamEvent.Complete complete = (StreamEvent.Complete) events.get(events.size() - 1);
        assertEquals("Hi there", complete.fullText());
        assertEquals(MODEL, complete.model());

        List<Message> messages = persisted();
        assertEquals(2, messages.size());
        assertEquals("Hi there", messages.get(1).getContent());
        assertEquals(MODEL, messages.get(1).getModel());
        assertEquals(ThoughtsStatus.NONE, messages.get(1).getThoughtsStatus());
        assertFalse(orchestrator.isChatActive(CHAT_ID));
        assertTrue(orchestrator.getActiveRequests().isEmpty());
    }

    @Test
    void shouldRunToolRoundTripAndContinue() {
        ScriptedProviderCall provider = new ScriptedProviderCall()
                .respond(TOOL_ROUND)
                .respond("data: {\"type\":\"delta\",\"content\":\"It is noon.\"}\ndata: [DONE]\n");

        StreamingRequest request = orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("What time is it?"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(List.of(
                "StatusChange", "PartialResponse", "MessagesAdded", "ToolCallRequest", "StatusChange",
                "MessagesAdded", "StatusChange", "PartialResponse", "Complete"), kinds(events));

        StreamEvent.ToolCallRequest toolCall = (StreamEvent.ToolCallRequest) events.get(3);
        assertEquals("clock", toolCall.toolId());
        assertEquals("call_1", toolCall.callId());
        assertEquals(Map.of("timezone", "UTC"), toolCall.parameters());
        assertEquals(RequestState.TOOL_PENDING, ((StreamEvent.StatusChange) events.get(4)).status());
        assertEquals(2, ((StreamEvent.MessagesAdded) events.get(5)).messageIds().size());
        assertEquals("It is noon.", ((StreamEvent.Complete) events.get(8)).fullText());

        assertEquals(List.of(Message.ROLE_USER, Message.ROLE_ASSISTANT, Message.ROLE_TOOL_CALL, Message.ROLE_TOOL,
                Message.ROLE_ASSISTANT), persistedRoles());
        List<Message> messages = persisted();
        assertEquals("Let me check", messages.get(1).getContent());
        assertEquals("call_1", messages.get(2).getToolCall().getId());
        assertEquals("call_1", messages.get(3).getToolCallId());
        assertEquals("12:00 UTC", messages.get(3).getContent());
        assertEquals("It is noon.", messages.get(4).getContent());

        assertEquals(List.of("clock"), executedTools);
        assertEquals(2, provider.calls.size());
        assertEquals(4, provider.calls.get(1).size());
        assertEquals(Message.ROLE_TOOL, provider.calls.get(1).get(3).getRole());
        assertEquals(RequestState.COMPLETED, request.getState());
        assertEquals(1, request.getToolRounds());
    }

    @Test
    void shouldPersistToolFailureAndContinue() {
        toolExecutor = (toolId, parameters) -> CompletableFuture.failedFuture(new IllegalStateException("boom"));
        ScriptedProviderCall provider = new ScriptedProviderCall()
                .respond(TOOL_ROUND)
                .respond("data: {\"type\":\"delta\",\"content\":\"The clock is broken.\"}\n");

        orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Time?"));
        List<StreamEvent> events = awaitEvents("r1");

        assertInstanceOf(StreamEvent.Complete.class, events.get(events.size() - 1));
        Message toolResponse = persisted().get(3);
        assertEquals(Message.ROLE_TOOL, toolResponse.getRole());
        assertEquals("Error: Tool clock failed: boom", toolResponse.getContent());
        assertEquals("The clock is broken.", persisted().get(4).getContent());
    }

    @Test
    void shouldAnswerInvalidArgumentsWithoutInvokingTool() {
        ScriptedProviderCall provider = new ScriptedProviderCall()
                .respond("data: {\"type\":\"tool_call\",\"id\":\"c9\",\"name\":\"clock\",\"arguments\":\"{bad\"}\n")
                .respond("data: {\"type\":\"delta\",\"content\":\"Sorry\"}\n");

        orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Time?"));
        awaitEvents("r1");

        assertTrue(executedTools.isEmpty());
        Message toolResponse = persisted().get(2);
        assertEquals("c9", toolResponse.getToolCallId());
        assertTrue(toolResponse.getContent().startsWith("Error: Invalid tool arguments:"));
    }

    @Test
    void shouldAttachThoughtsToAssistantMessage() {
        ScriptedProviderCall provider = new ScriptedProviderCall()
                .respond("data: {\"type\":\"thinking\",\"content\":\"hmm\"}\n"
                        + "data: {\"type\":\"delta\",\"content\":\"Answer\"}\n");

        orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Think"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(List.of("StatusChange", "ThinkingStarted", "ThinkingPartial", "ThinkingComplete",
                "PartialResponse", "Complete"), kinds(events));
        assertEquals(ThoughtsStatus.PRESENT, ((StreamEvent.ThinkingComplete) events.get(3)).status());
        Message answer = persisted().get(1);
        assertEquals("Answer", answer.getContent());
        assertEquals("hmm", answer.getThoughts());
        assertEquals(ThoughtsStatus.PRESENT, answer.getThoughtsStatus());
        assertEquals(Double.valueOf(0.0), answer.getThinkingDurationSeconds());
    }

    // ==================== FAILURES ====================

    @Test
    void shouldFailOnEmptyResponse() {
        orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond("data: [DONE]\n"),
                seedUserMessage("Hi"));
        List<StreamEvent> events = awaitEvents("r1");

        StreamEvent last = events.get(events.size() - 1);
        assertEquals("Empty response from provider", ((StreamEvent.Error) last).message());
        assertEquals(1, persisted().size());
    }

    @Test
    void shouldFailOnProviderErrorEvent() {
        orchestrator.start("r1", CHAT_ID,
                new ScriptedProviderCall().respond("data: {\"type\":\"delta\",\"content\":\"par\"}\n"
                        + "data: {\"type\":\"error\",\"message\":\"overloaded\"}\n"),
                seedUserMessage("Hi"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Error("r1", CHAT_ID, "overloaded"), events.get(events.size() - 1));
        assertEquals(1, terminalCount(events));
        assertEquals(List.of(Message.ROLE_USER), persistedRoles());
    }

    @Test
    void shouldKeepPersistedMessagesWhenTransportFails() {
        ScriptedProviderCall provider = new ScriptedProviderCall()
                .respond(TOOL_ROUND)
                .fail(new IOException("connection refused"));

        StreamingRequest request = orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Time?"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Error("r1", CHAT_ID, "connection refused"), events.get(events.size() - 1));
        assertEquals(List.of(Message.ROLE_USER, Message.ROLE_ASSISTANT, Message.ROLE_TOOL_CALL, Message.ROLE_TOOL),
                persistedRoles());
        assertEquals(RequestState.FAILED, request.getState());
    }

    @Test
    void shouldDiscardUnsavedTextWhenStreamBreaks() {
        LineSource breaking = new LineSource() {
            private int reads;

            @Override
            public String readLine() throws IOException {
                if (reads++ == 0) {
                    return "data: {\"type\":\"delta\",\"content\":\"half\"}";
                }
                throw new IOException("reset");
            }

            @Override
            public void close() {
                // nothing to release
            }
        };

        orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond(breaking), seedUserMessage("Hi"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Error("r1", CHAT_ID, "Stream interrupted: reset"), events.get(events.size() - 1));
        assertEquals(1, persisted().size());
    }

    @Test
    void shouldFailWhenToolRoundLimitIsReached() {
        properties.getTurn().setMaxToolRounds(2);
        ScriptedProviderCall provider = new ScriptedProviderCall().respond(TOOL_ROUND).respond(TOOL_ROUND)
                .respond(TOOL_ROUND);

        orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Loop"));
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Error("r1", CHAT_ID, "Tool call limit reached (2)"),
                events.get(events.size() - 1));
        assertEquals(3, provider.calls.size());
        assertEquals(2, executedTools.size());
        assertEquals(1 + 3 * 2, persisted().size());
    }

    @Test
    void shouldFailWhenStorageFails() {
        List<Message> context = seedUserMessage("Hi");
        conversationPort.failSavesWith(new IllegalStateException("disk full"));

        orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall()
                .respond("data: {\"type\":\"delta\",\"content\":\"Hello\"}\n"), context);
        List<StreamEvent> events = awaitEvents("r1");

        StreamEvent.Error error = (StreamEvent.Error) events.get(events.size() - 1);
        assertTrue(error.message().contains("disk full"));
        assertFalse(orchestrator.isChatActive(CHAT_ID));
    }

    @Test
    void shouldRejectDuplicateRequestId() {
        BlockingLineSource source = new BlockingLineSource();
        orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond(source), seedUserMessage("Hi"));

        assertThrows(IllegalStateException.class,
                () -> orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall(), List.of()));

        orchestrator.cancel("r1");
    }

    @Test
    void shouldRejectUnknownDialect() {
        ProviderCall unknown = new ScriptedProviderCall("no-such-dialect");

        assertThrows(IllegalArgumentException.class, () -> orchestrator.start("r1", CHAT_ID, unknown, List.of()));
        assertTrue(orchestrator.getActiveRequests().isEmpty());
    }

    // ==================== CANCEL / STOP ====================

    @Test
    void shouldCancelStreamingRequestWithSingleTerminalEvent() {
        BlockingLineSource source = new BlockingLineSource();
        StreamingRequest request = orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond(source),
                seedUserMessage("Hi"));
        source.push("data: {\"type\":\"delta\",\"content\":\"partial\"}");
        awaitFirst("r1", StreamEvent.PartialResponse.class);

        orchestrator.cancel("r1");
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.StatusChange("r1", CHAT_ID, RequestState.CANCELLED),
                events.get(events.size() - 1));
        assertEquals(1, terminalCount(events));
        assertEquals(RequestState.CANCELLED, request.getState());
        assertTrue(source.isClosed());
        assertEquals(1, persisted().size());
        assertFalse(orchestrator.isChatActive(CHAT_ID));

        orchestrator.cancel("r1");
        assertEquals(events, awaitEvents("r1"));
    }

    @Test
    void shouldIgnoreCancelAfterCompletion() {
        StreamingRequest request = orchestrator.start("r1", CHAT_ID,
                new ScriptedProviderCall().respond("data: {\"type\":\"delta\",\"content\":\"done\"}\n"),
                seedUserMessage("Hi"));
        List<StreamEvent> before = awaitEvents("r1");

        orchestrator.cancel("r1");
        orchestrator.cancel("unknown");

        assertEquals(before, awaitEvents("r1"));
        assertEquals(RequestState.COMPLETED, request.getState());
        assertEquals(2, persisted().size());
    }

    @Test
    void shouldCancelWhileWaitingForTool() {
        CompletableFuture<ToolResult> neverCompletes = new CompletableFuture<>();
        toolExecutor = (toolId, parameters) -> neverCompletes;
        orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond(TOOL_ROUND), seedUserMessage("Time?"));
        StreamEvent pending = orchestrator.events("r1")
                .filter(event -> event instanceof StreamEvent.StatusChange change
                        && change.status() == RequestState.TOOL_PENDING)
                .blockFirst(WAIT);
        assertNotNull(pending);

        orchestrator.cancel("r1");
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(RequestState.CANCELLED, ((StreamEvent.StatusChange) events.get(events.size() - 1)).status());
        assertTrue(neverCompletes.isCancelled());
        assertEquals(List.of(Message.ROLE_USER, Message.ROLE_ASSISTANT, Message.ROLE_TOOL_CALL), persistedRoles());
    }

    @Test
    void shouldStopAndPersistPartialText() {
        BlockingLineSource source = new BlockingLineSource();
        StreamingRequest request = orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond(source),
                seedUserMessage("Write a long story"));
        source.push("data: {\"type\":\"delta\",\"content\":\"Once upon\"}");
        awaitFirst("r1", StreamEvent.PartialResponse.class);

        orchestrator.stopAndComplete("r1");
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Complete("r1", CHAT_ID, "Once upon", MODEL), events.get(events.size() - 1));
        assertEquals(1, terminalCount(events));
        assertEquals(RequestState.COMPLETED, request.getState());
        assertEquals("Once upon", persisted().get(1).getContent());
    }

    @Test
    void shouldStopWhileWaitingForToolWithSyntheticResponse() {
        CompletableFuture<ToolResult> neverCompletes = new CompletableFuture<>();
        toolExecutor = (toolId, parameters) -> neverCompletes;
        orchestrator.start("r1", CHAT_ID, new ScriptedProviderCall().respond(TOOL_ROUND), seedUserMessage("Time?"));
        orchestrator.events("r1")
                .filter(event -> event instanceof StreamEvent.StatusChange change
                        && change.status() == RequestState.TOOL_PENDING)
                .blockFirst(WAIT);

        orchestrator.stopAndComplete("r1");
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Complete("r1", CHAT_ID, "", MODEL), events.get(events.size() - 1));
        List<Message> messages = persisted();
        assertEquals(4, messages.size());
        assertEquals("Error: Tool execution stopped", messages.get(3).getContent());
        assertEquals("call_1", messages.get(3).getToolCallId());
    }

    @Test
    void shouldCancelWhileWaitingForResponseHeaders() throws InterruptedException {
        HangingProviderCall provider = new HangingProviderCall();
        StreamingRequest request = orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Hi"));
        assertTrue(provider.opened.await(10, TimeUnit.SECONDS));

        orchestrator.cancel("r1");
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.StatusChange("r1", CHAT_ID, RequestState.CANCELLED),
                events.get(events.size() - 1));
        assertEquals(RequestState.CANCELLED, request.getState());
        assertTrue(provider.aborted.await(10, TimeUnit.SECONDS));
        assertEquals(1, persisted().size());
    }

    @Test
    void shouldStopWhileWaitingForResponseHeaders() throws InterruptedException {
        HangingProviderCall provider = new HangingProviderCall();
        StreamingRequest request = orchestrator.start("r1", CHAT_ID, provider, seedUserMessage("Hi"));
        assertTrue(provider.opened.await(10, TimeUnit.SECONDS));

        orchestrator.stopAndComplete("r1");
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(new StreamEvent.Complete("r1", CHAT_ID, "", MODEL), events.get(events.size() - 1));
        assertEquals(RequestState.COMPLETED, request.getState());
        assertEquals(0, provider.aborted.getCount());
        assertEquals(1, persisted().size());
    }

    @Test
    void shouldLetCancelWaitForFinalSaveInProgress() throws InterruptedException {
        List<Message> context = seedUserMessage("Hi");
        CountDownLatch saving = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        conversationPort.onSave(() -> {
            saving.countDown();
            awaitQuietly(release);
        });
        StreamingRequest request = orchestrator.start("r1", CHAT_ID,
                new ScriptedProviderCall().respond("data: {\"type\":\"delta\",\"content\":\"Hello\"}\ndata: [DONE]\n"),
                context);
        assertTrue(saving.await(10, TimeUnit.SECONDS));

        Thread canceller = new Thread(() -> orchestrator.cancel("r1"));
        canceller.start();
        canceller.join(300);
        assertTrue(canceller.isAlive());

        release.countDown();
        canceller.join(10_000);
        List<StreamEvent> events = awaitEvents("r1");

        assertEquals(1, terminalCount(events));
        assertEquals(new StreamEvent.Complete("r1", CHAT_ID, "Hello", MODEL), events.get(events.size() - 1));
        assertEquals(RequestState.COMPLETED, request.getState());
        assertEquals(2, persisted().size());
    }

    // ==================== SLOW SUBSCRIBERS ====================

    @Test
    void shouldCompleteWhileGlobalSubscriberIsStuck() {
        CountDownLatch release = new CountDownLatch(1);
        Disposable stuck = orchestrator.events().subscribe(event -> awaitQuietly(release));
        try {
            StreamingRequest request = orchestrator.start("r1", CHAT_ID,
                    new ScriptedProviderCall().respond("data: {\"type\":\"delta\",\"content\":\"Hi\"}\ndata: [DONE]\n"),
                    seedUserMessage("Hello"));

            List<StreamEvent> events = awaitEvents("r1");

            assertEquals("Complete", kinds(events).get(events.size() - 1));
            assertEquals(RequestState.COMPLETED, request.getState());
            assertEquals(2, persisted().size());
        } finally {
            release.countDown();
            stuck.dispose();
        }
    }

    @Test
    void shouldNotStallOtherChatsWhenChatSubscriberIsStuck() {
        CountDownLatch release = new CountDownLatch(1);
        Disposable stuck = orchestrator.eventsForChat("chat-A").subscribe(event -> awaitQuietly(release));
        try {
            BlockingLineSource chatA = new BlockingLineSource();
            orchestrator.start("rA", "chat-A", new ScriptedProviderCall().respond(chatA), List.of());
            chatA.push("data: {\"type\":\"delta\",\"content\":\"first\"}");
            awaitFirst("rA", StreamEvent.PartialResponse.class);

            StreamingRequest other = orchestrator.start("rB", CHAT_ID,
                    new ScriptedProviderCall().respond("data: {\"type\":\"delta\",\"content\":\"Hi\"}\ndata: [DONE]\n"),
                    seedUserMessage("Hello"));
            List<StreamEvent> events = awaitEvents("rB");

            assertEquals("Complete", kinds(events).get(events.size() - 1));
            assertEquals(RequestState.COMPLETED, other.getState());
            orchestrator.cancel("rA");
        } finally {
            release.countDown();
            stuck.dispose();
        }
    }

    // ==================== FAKES ====================

    /**
     * Provider that replays scripted responses, one per call, and records the
     * context of every call.
     */
    private static final class ScriptedProviderCall implements ProviderCall {

        private final String dialectId;
        private final Deque<Object> script = new ArrayDeque<>();
        final List<List<Message>> calls = new CopyOnWriteArrayList<>();

        ScriptedProviderCall() {
            this(DIALECT);
        }

        ScriptedProviderCall(String dialectId) {
            this.dialectId = dialectId;
        }

        ScriptedProviderCall respond(String body) {
            script.add(body);
            return this;
        }

        ScriptedProviderCall respond(LineSource source) {
            script.add(source);
            return this;
        }

        ScriptedProviderCall fail(IOException failure) {
            script.add(failure);
            return this;
        }

        @Override
        public String getDialectId() {
            return dialectId;
        }

        @Override
        public String getModel() {
            return MODEL;
        }

        @Override
        public synchronized LineSource open(List<Message> messages, Consumer<Closeable> abortHandle)
                throws IOException {
            calls.add(new ArrayList<>(messages));
            Object next = script.poll();
            if (next == null) {
                throw new IOException("No scripted response");
            }
            if (next instanceof IOException failure) {
                throw failure;
            }
            if (next instanceof LineSource source) {
                return source;
            }
            return ReaderLineSource.of((String) next);
        }
    }

    /**
     * Provider whose call never receives response headers until its abort handle
     * is closed. Ignores thread interrupts, like a blocking socket read.
     */
    private static final class HangingProviderCall implements ProviderCall {

        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch aborted = new CountDownLatch(1);

        @Override
        public String getDialectId() {
            return DIALECT;
        }

        @Override
        public String getModel() {
            return MODEL;
        }

        @Override
        public LineSource open(List<Message> messages, Consumer<Closeable> abortHandle) throws IOException {
            abortHandle.accept(aborted::countDown);
            opened.countDown();
            boolean interrupted = false;
            try {
                while (true) {
                    try {
                        if (aborted.await(30, TimeUnit.SECONDS)) {
                            throw new IOException("Canceled");
                        }
                        throw new IOException("No response headers");
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Line source fed by the test; a blocked read fails once the source is
     * closed.
     */
    private static final class BlockingLineSource implements LineSource {

        private static final String CLOSED = "\u0000closed";

        private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        void push(String line) {
            lines.add(line);
        }

        boolean isClosed() {
            return closed;
        }

        @Override
        public String readLine() throws IOException {
            if (closed) {
                throw new IOException("Stream closed");
            }
            try {
                String line = lines.take();
                if (CLOSED.equals(line)) {
                    throw new IOException("Stream closed");
                }
                return line;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted");
            }
        }

        @Override
        public void close() {
            closed = true;
            lines.add(CLOSED);
        }
    }
}
