package me.golemcore.streamchat.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Closeable;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class StreamingRequestTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private StreamingRequest request;

    @BeforeEach
    void setUp() {
        request = new StreamingRequest("r1", "c1", "model", START);
    }

    @Test
    void shouldAllowOnlyOneTerminalTransition() {
        assertTrue(request.moveTo(RequestState.STREAMING));
        assertTrue(request.moveTo(RequestState.TOOL_PENDING));

        assertTrue(request.terminate(RequestState.CANCELLED));
        assertFalse(request.terminate(RequestState.COMPLETED));
        assertFalse(request.moveTo(RequestState.STREAMING));

        assertEquals(RequestState.CANCELLED, request.getState());
        assertTrue(request.isFinished());
        assertTrue(request.isCancelled());
    }

    @Test
    void shouldRejectNonTerminalStateInTerminate() {
        assertThrows(IllegalArgumentException.class, () -> request.terminate(RequestState.STREAMING));
    }

    @Test
    void shouldDrainText() {
        request.appendText("Hello");
        request.appendText(" world");

        assertTrue(request.hasText());
        assertEquals("Hello world", request.drainText());
        assertFalse(request.hasText());
        assertEquals("", request.getText());
    }

    @Test
    void shouldAccumulateThinkingAcrossPhases() {
        request.startThinking(START);
        request.appendThinking("first ");
        assertEquals(1.5, request.finishThinking(START.plusMillis(1500)));

        request.startThinking(START.plusSeconds(2));
        request.appendThinking("second");
        request.finishThinking(START.plusSeconds(3));

        assertEquals(Double.valueOf(2.5), request.getThinkingDurationSeconds());
        assertEquals("first second", request.getThoughts());
        assertEquals(ThoughtsStatus.PRESENT, request.getThoughtsStatus());

        request.clearThoughts();
        assertEquals(ThoughtsStatus.NONE, request.getThoughtsStatus());
    }

    @Test
    void shouldReportUnavailableThoughtsWhenOnlyTimed() {
        request.startThinking(START);
        request.finishThinking(START.plusSeconds(1));

        assertEquals(ThoughtsStatus.UNAVAILABLE, request.getThoughtsStatus());
    }

    @Test
    void shouldAbortAttachedWaits() {
        AtomicBoolean closed = new AtomicBoolean();
        Closeable source = () -> closed.set(true);
        CompletableFuture<ToolResult> tool = new CompletableFuture<>();
        CompletableFuture<Void> task = new CompletableFuture<>();
        request.attachSource(source);
        request.attachPendingTool(tool);
        request.attachTask(task);

        request.abort(false);

        assertTrue(closed.get());
        assertTrue(tool.isCancelled());
        assertFalse(task.isCancelled());

        request.abort(true);
        assertTrue(task.isCancelled());
    }
}
