package me.golemcore.streamchat;

import me.golemcore.streamchat.adapter.outbound.llm.OkHttpProviderCallFactory;
import me.golemcore.streamchat.domain.service.DialectRegistry;
import me.golemcore.streamchat.domain.service.RequestOrchestrator;
import me.golemcore.streamchat.domain.service.ToolRegistry;
import me.golemcore.streamchat.infrastructure.config.StreamChatProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class StreamChatApplicationTest {

    @TempDir
    static Path workspace;

    @DynamicPropertySource
    static void workspaceProperties(DynamicPropertyRegistry registry) {
        registry.add("chat.storage.local.base-path", () -> workspace.toString());
    }

    @Autowired
    private RequestOrchestrator orchestrator;

    @Autowired
    private DialectRegistry dialectRegistry;

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private OkHttpProviderCallFactory providerCallFactory;

    @Autowired
    private StreamChatProperties properties;

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(StreamChatApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(StreamChatApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldWireContextFromApplicationProperties() {
        assertNotNull(orchestrator);
        assertNotNull(providerCallFactory);
        assertTrue(dialectRegistry.find("anthropic").isPresent());
        assertTrue(toolRegistry.find("get_current_datetime").isPresent());
        assertEquals(25, properties.getTurn().getMaxToolRounds());
        assertEquals(Duration.ofMinutes(5), properties.getTurn().getToolTimeout());
        assertTrue(Files.isDirectory(workspace.resolve("conversations")));
    }
}
