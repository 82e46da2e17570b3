package me.golemcore.streamchat.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.streamchat.domain.stream.CanonicalEventKind;
import me.golemcore.streamchat.domain.stream.PayloadMatcher;
import me.golemcore.streamchat.domain.stream.StreamDialect;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import me.golemcore.streamchat.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class DialectRegistryTest {

    private static final String DIALECTS_DIR = "dialects";
    private static final String DIALECTS_FILE = "dialects.json";

    @Mock
    private StoragePort storagePort;

    private DialectRegistry registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(storagePort.exists(DIALECTS_DIR, DIALECTS_FILE)).thenReturn(CompletableFuture.completedFuture(false));
        registry = new DialectRegistry(storagePort, new StreamChatProperties(), new ObjectMapper());
    }

    @Test
    void shouldLoadBundledDialects() {
        registry.init();

        assertTrue(registry.find("openai-chat").isPresent());
        assertTrue(registry.find("openai-responses").isPresent());
        assertTrue(registry.find("anthropic").isPresent());
        assertTrue(registry.find("google").isPresent());
        assertTrue(registry.find("openrouter").isPresent());
        assertEquals("type", registry.get("generic-delta").getEventTypeField());
        assertEquals("[DONE]", registry.get("openai-chat").getDoneMarker());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void shouldThrowForUnknownDialect() {
        registry.init();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> registry.get("missing"));
        assertEquals("Unknown stream dialect: missing", error.getMessage());
    }

    @Test
    void shouldOverrideFromWorkspaceFile() {
        when(storagePort.exists(DIALECTS_DIR, DIALECTS_FILE)).thenReturn(CompletableFuture.completedFuture(true));
        when(storagePort.getText(DIALECTS_DIR, DIALECTS_FILE)).thenReturn(CompletableFuture.completedFuture("""
                {"dialects":[
                  {"id":"openai-chat","eventTypeField":null,"doneMarker":"<END>","matchers":[]},
                  {"id":"local-llm","eventTypeField":"kind","matchers":[
                    {"kind":"TEXT_DELTA","eventType":"token","textPointer":"/text"}]}
                ]}
                """));

        registry.init();

        assertEquals("<END>", registry.get("openai-chat").getDoneMarker());
        StreamDialect local = registry.get("local-llm");
        assertEquals("kind", local.getEventTypeField());
        assertEquals("[DONE]", local.getDoneMarker());
        assertEquals(CanonicalEventKind.TEXT_DELTA, local.getMatchers().get(0).getKind());
    }

    @Test
    void shouldKeepBundledDialectsWhenWorkspaceFileIsBroken() {
        when(storagePort.exists(DIALECTS_DIR, DIALECTS_FILE)).thenReturn(CompletableFuture.completedFuture(true));
        when(storagePort.getText(DIALECTS_DIR, DIALECTS_FILE)).thenReturn(CompletableFuture.completedFuture("{oops"));

        registry.init();

        assertTrue(registry.find("anthropic").isPresent());
    }

    @Test
    void shouldRejectInvalidPointer() {
        StreamDialect dialect = StreamDialect.builder()
                .id("broken")
                .matchers(List.of(PayloadMatcher.builder()
                        .kind(CanonicalEventKind.TEXT_DELTA)
                        .textPointer("no-leading-slash")
                        .build()))
                .build();

        assertThrows(IllegalArgumentException.class, () -> registry.register(dialect));
        assertTrue(registry.find("broken").isEmpty());
    }

    @Test
    void shouldRejectMatcherWithoutKind() {
        StreamDialect dialect = StreamDialect.builder()
                .id("broken")
                .matchers(List.of(PayloadMatcher.builder().textPointer("/text").build()))
                .build();

        assertThrows(IllegalArgumentException.class, () -> registry.register(dialect));
    }
}
