package com.example.intent.llm;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import com.example.intent.config.AppConfig;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SpringAiLlmProviderTest {

    private final AppConfig config = new AppConfig("ollama", "llama3", "llama3", "", "", 1024, 0.2);

    @ParameterizedTest
    @CsvSource({
        "'rate limit exceeded',          rate_limit",
        "'status 429: too many requests', rate_limit",
        "'context deadline exceeded: timeout', timeout",
        "'request timed out',            timeout",
        "'401 unauthorized',             auth_error",
        "'403 forbidden',                auth_error",
        "'authentication failed',        auth_error",
        "'invalid api key',              auth_error",
        "'model llama9 not found',       model_not_found",
        "'400 bad request',              invalid_request",
        "'422 unprocessable entity',     invalid_request",
        "'invalid model name',           invalid_request",
        "'500 internal server error',    server_error",
        "'502 bad gateway',              server_error",
        "'503 service unavailable',      server_error",
        "'connection refused',           network_error",
        "'dns resolution failed',        network_error",
        "'connection reset by peer',     network_error",
        "'something unexpected',         unknown_error",
    })
    void classifyErrorCategories(String message, String expected) {
        var error = new RuntimeException(message);
        assertEquals(expected, SpringAiLlmProvider.classifyError(error),
            "classifyError(\"" + message + "\") should be " + expected);
    }

    @Test
    void classifyErrorNull() {
        assertEquals("unknown_error", SpringAiLlmProvider.classifyError(null));
    }

    @Test
    void jsonCompletionAddsJsonInstruction() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.call(any(Prompt.class)))
            .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("{\"ok\": true}")))));
        var provider = new SpringAiLlmProvider(chatModel, null, mock(EmbeddingModel.class), config);

        StepVerifier.create(provider.generateCompletion("llama3", "classify this", GenerationParams.json(0.3)))
            .expectNext("{\"ok\": true}")
            .verifyComplete();

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        var instructions = prompt.getValue().getInstructions();
        assertEquals(2, instructions.size());
        assertInstanceOf(SystemMessage.class, instructions.get(0));
        assertEquals("classify this", instructions.get(1).getText());
        assertEquals("llama3", prompt.getValue().getOptions().getModel());
    }

    @Test
    void batchEmbeddingsKeepInputOrder() {
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.call(any(EmbeddingRequest.class))).thenReturn(new EmbeddingResponse(List.of(
            new Embedding(new float[] {1f, 0f}, 0),
            new Embedding(new float[] {0f, 1f}, 1))));
        var provider = new SpringAiLlmProvider(mock(ChatModel.class), null, embeddingModel, config);

        StepVerifier.create(provider.generateBatchEmbeddings("nomic-embed-text", List.of("a", "b")))
            .assertNext(vectors -> {
                assertEquals(2, vectors.size());
                assertArrayEquals(new float[] {1f, 0f}, vectors.get(0));
                assertArrayEquals(new float[] {0f, 1f}, vectors.get(1));
            })
            .verifyComplete();

        ArgumentCaptor<EmbeddingRequest> request = ArgumentCaptor.forClass(EmbeddingRequest.class);
        verify(embeddingModel).call(request.capture());
        assertEquals(List.of("a", "b"), request.getValue().getInstructions());
        assertEquals("nomic-embed-text", request.getValue().getOptions().getModel());
    }

    @Test
    void embeddingCountMismatchFails() {
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.call(any(EmbeddingRequest.class))).thenReturn(new EmbeddingResponse(List.of(
            new Embedding(new float[] {1f, 0f}, 0))));
        var provider = new SpringAiLlmProvider(mock(ChatModel.class), null, embeddingModel, config);

        StepVerifier.create(provider.generateBatchEmbeddings("nomic-embed-text", List.of("a", "b")))
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    void emptyBatchSkipsTheModel() {
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
        var provider = new SpringAiLlmProvider(mock(ChatModel.class), null, embeddingModel, config);

        StepVerifier.create(provider.generateBatchEmbeddings("nomic-embed-text", List.of()))
            .assertNext(vectors -> assertTrue(vectors.isEmpty()))
            .verifyComplete();
        verifyNoInteractions(embeddingModel);
    }

    @Test
    void chatBeanNames() {
        assertEquals("ollamaChatModel", LlmConfig.chatBeanName("ollama"));
        assertEquals("openAiChatModel", LlmConfig.chatBeanName("openai"));
        assertThrows(IllegalArgumentException.class, () -> LlmConfig.chatBeanName("mystery"));
    }
}
