package me.golemcore.warranty.adapter.outbound.llm;

import me.golemcore.warranty.domain.model.LlmRequest;
import me.golemcore.warranty.domain.model.LlmResponse;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private AgentProperties properties;
    private LlmProviderAdapter langchain4j;
    private NoOpLlmAdapter noOp;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        langchain4j = mock(LlmProviderAdapter.class);
        when(langchain4j.getProviderId()).thenReturn("langchain4j");
        noOp = new NoOpLlmAdapter();
    }

    @Test
    void shouldSelectConfiguredProvider() throws Exception {
        LlmRequest request = LlmRequest.builder().userPrompt("hi").build();
        LlmResponse response = LlmResponse.builder().content("NEXT_STEP: DONE").build();
        when(langchain4j.chat(request)).thenReturn(CompletableFuture.completedFuture(response));
        when(langchain4j.isAvailable()).thenReturn(true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noOp));
        factory.init();

        assertSame(langchain4j, factory.getActiveAdapter());
        assertEquals("langchain4j", factory.getProviderId());
        assertSame(response, factory.chat(request).get());
        assertTrue(factory.isAvailable());
        verify(langchain4j).initialize();
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() {
        properties.getLlm().setProvider("mystery");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noOp));
        factory.init();

        assertSame(noOp, factory.getActiveAdapter());
        assertFalse(factory.isAvailable());
        assertSame(langchain4j, factory.getAdapter("langchain4j"));
    }

    @Test
    void shouldFailChatWithoutAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> factory.chat(LlmRequest.builder().build()).get());

        assertTrue(ex.getCause() instanceof IllegalStateException);
        assertEquals("none", factory.getProviderId());
    }
}
