package com.example.intent.reasoning;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.intent.config.ReasoningProperties;
import com.example.intent.llm.ParseResult;
import com.example.intent.llm.StubLlmProvider;
import com.example.intent.model.ChainOfThoughtResult;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.ReasoningVerification;
import com.example.intent.telemetry.IntentMetrics;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningEngineTest {

    private static final String DRAFT_PROMPT = "Work through the following request";
    private static final String VERIFY_PROMPT = "Review this step-by-step reasoning";

    private static final String DRAFT = """
        ```json
        {
          "reasoning": [
            {"step": 1, "thought": "The user asks about churn", "conclusion": "Need churn for Q3"},
            {"step": 2, "thought": "Churn is cancellations over active users", "conclusion": "Divide the counts"}
          ],
          "finalConclusion": "Compute Q3 churn from cancellations",
          "confidenceScore": 0.7,
          "entities": [{"type": "period", "value": "Q3", "importance": 8}],
          "suggestedActions": ["query_cancellations", "query_active_users"]
        }
        ```
        """;

    private final StubLlmProvider llm = new StubLlmProvider();

    private ReasoningEngine engine(boolean verification) {
        return new ReasoningEngine(llm, new ReasoningProperties("llama3", verification, 10), new IntentMetrics());
    }

    @Test
    void draftIsVerifiedAndRevised() {
        llm.whenPromptContains(DRAFT_PROMPT, DRAFT)
            .whenPromptContains(VERIFY_PROMPT, """
                {"isValid": false, "confidenceScore": 0.8,
                 "issues": [{"step": 2, "issue": "Wrong denominator", "correction": "Divide by users at start of Q3"}],
                 "improvedConclusion": "Compute Q3 churn against users at the start of the quarter"}
                """);

        StepVerifier.create(engine(true).performChainOfThoughtReasoning("What was churn in Q3?", List.of()))
            .assertNext(result -> {
                assertTrue(result.verified());
                assertFalse(result.hasError());
                assertEquals(0.8, result.confidenceScore(), 1e-9);
                assertEquals("Compute Q3 churn against users at the start of the quarter", result.finalConclusion());
                assertTrue(result.reasoningSteps().get(1).revised());
                assertEquals(0.8, result.extractedEntities().get(0).confidence(), 1e-9);
                assertEquals(List.of("query_cancellations", "query_active_users"), result.suggestedActions());
            })
            .verifyComplete();

        assertTrue(llm.prompts().get(1).contains("Compute Q3 churn from cancellations"));
    }

    @Test
    void verificationCanBeDisabled() {
        llm.whenPromptContains(DRAFT_PROMPT, DRAFT);

        StepVerifier.create(engine(false).performChainOfThoughtReasoning("What was churn in Q3?", null))
            .assertNext(result -> {
                assertFalse(result.verified());
                assertEquals(0.7, result.confidenceScore(), 1e-9);
                assertEquals(2, result.reasoningSteps().size());
            })
            .verifyComplete();

        assertEquals(1, llm.prompts().size());
        assertTrue(llm.prompts().get(0).contains("No previous context available."));
    }

    @Test
    void failedVerificationKeepsDraft() {
        llm.whenPromptContains(DRAFT_PROMPT, DRAFT)
            .failWhenPromptContains(VERIFY_PROMPT, new RuntimeException("timeout"));

        StepVerifier.create(engine(true).performChainOfThoughtReasoning("What was churn in Q3?", List.of()))
            .assertNext(result -> {
                assertFalse(result.verified());
                assertFalse(result.hasError());
                assertEquals("Compute Q3 churn from cancellations", result.finalConclusion());
            })
            .verifyComplete();
    }

    @Test
    void unreadableVerificationKeepsDraft() {
        llm.whenPromptContains(DRAFT_PROMPT, DRAFT)
            .whenPromptContains(VERIFY_PROMPT, "Looks good to me");

        StepVerifier.create(engine(true).performChainOfThoughtReasoning("What was churn in Q3?", List.of()))
            .assertNext(result -> assertEquals(0.7, result.confidenceScore(), 1e-9))
            .verifyComplete();
    }

    @Test
    void unreadableDraftIsAnErrorResult() {
        llm.whenPromptContains(DRAFT_PROMPT, "I think churn was high");

        StepVerifier.create(engine(true).performChainOfThoughtReasoning("What was churn in Q3?", List.of()))
            .assertNext(result -> {
                assertTrue(result.hasError());
                assertEquals(0.0, result.confidenceScore());
                assertEquals("Failed to parse reasoning response", result.errorMessage());
                assertEquals(1, result.reasoningSteps().size());
            })
            .verifyComplete();
    }

    @Test
    void providerFailureIsAnErrorResult() {
        llm.failWhenPromptContains(DRAFT_PROMPT, new RuntimeException("connection refused"));

        StepVerifier.create(engine(true).performChainOfThoughtReasoning("What was churn in Q3?", List.of()))
            .assertNext(result -> {
                assertTrue(result.hasError());
                assertEquals("Error during reasoning: connection refused", result.errorMessage());
                assertEquals("Unable to provide reasoning due to an error", result.finalConclusion());
            })
            .verifyComplete();
    }

    @Test
    void conversationIsIncludedInThePrompt() {
        llm.whenPromptContains(DRAFT_PROMPT, DRAFT);
        List<ConversationMessage> messages = List.of(
            ConversationMessage.user("show me Q3 numbers"),
            ConversationMessage.assistant("Which metric?"));

        engine(false).performChainOfThoughtReasoning("churn", messages).block();

        assertTrue(llm.prompts().get(0).contains("user: show me Q3 numbers"));
    }

    @Test
    void emptyQueryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine(true).performChainOfThoughtReasoning(" ", List.of()));
    }

    @Test
    void draftDefaultsForMissingFields() {
        ParseResult<ChainOfThoughtResult> parsed = ReasoningEngine.parseDraft(
            "{\"reasoning\": [{\"thought\": \"a\"}, {\"thought\": \"b\"}], \"confidenceScore\": 4}");

        assertTrue(parsed.isOk());
        ChainOfThoughtResult draft = parsed.value();
        assertEquals("No conclusion provided", draft.finalConclusion());
        assertEquals(1.0, draft.confidenceScore(), 1e-9);
        assertEquals(1, draft.reasoningSteps().get(0).stepNumber());
        assertEquals(2, draft.reasoningSteps().get(1).stepNumber());
    }

    @Test
    void verificationDefaults() {
        ReasoningVerification verification = ReasoningEngine.parseVerification("{\"confidenceScore\": \"n/a\"}").value();

        assertTrue(verification.valid());
        assertNull(verification.confidenceScore());
        assertNull(verification.improvedConclusion());
        assertTrue(verification.issues().isEmpty());
    }
}
