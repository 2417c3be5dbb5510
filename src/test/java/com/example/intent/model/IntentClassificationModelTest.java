package com.example.intent.model;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassificationModelTest {

    private IntentClassificationModel model;

    @BeforeEach
    void setUp() {
        model = new IntentClassificationModel("nomic-embed-text", 0.7);
        model.addIntent(new IntentDefinition("account_management", "Accounts", List.of()));
        model.addIntent(new IntentDefinition("billing_inquiry", "Bills", List.of()));
        model.addIntent(new IntentDefinition("greeting", "Hello", List.of()));
    }

    @Test
    void namesAndAliasesResolveCaseInsensitively() {
        model.addAlias("Billing", "billing_inquiry");

        assertEquals("billing_inquiry", model.resolveIntentName("BILLING_INQUIRY"));
        assertEquals("billing_inquiry", model.resolveIntentName("billing"));
        assertThrows(IllegalArgumentException.class, () -> model.resolveIntentName("weather"));
    }

    @Test
    void aliasMustPointAtAnExistingIntent() {
        assertThrows(IllegalArgumentException.class, () -> model.addAlias("forecast", "weather"));
        assertThrows(IllegalArgumentException.class, () -> model.addAlias(" ", "greeting"));
    }

    @Test
    void removingAnIntentRemovesItsAliasesAndLinks() {
        model.addAlias("hey", "greeting");
        model.addAlias("hello_intent", "greeting");
        model.addAlias("billing", "billing_inquiry");
        model.linkIntents("greeting", "billing_inquiry");

        assertEquals(2, model.removeIntent("greeting"));

        assertEquals(2, model.size());
        assertTrue(model.findIntent("hey").isEmpty());
        assertEquals("billing_inquiry", model.resolveIntentName("billing"));
        assertNull(model.findIntent("billing_inquiry").get().getParentIntent());
        assertEquals(-1, model.removeIntent("greeting"));
    }

    @Test
    void relinkingMovesTheChild() {
        model.linkIntents("account_management", "billing_inquiry");
        model.linkIntents("greeting", "billing_inquiry");

        IntentDefinition billing = model.findIntent("billing_inquiry").get();
        assertEquals("greeting", billing.getParentIntent());
        assertTrue(model.findIntent("account_management").get().getChildIntents().isEmpty());
        assertTrue(model.findIntent("greeting").get().isRelatedTo("billing_inquiry"));
        assertTrue(billing.isRelatedTo("GREETING"));
        assertThrows(IllegalArgumentException.class, () -> model.linkIntents("greeting", "greeting"));
    }

    @Test
    void replacingAnIntentKeepsItsLinksAndOrder() {
        model.linkIntents("account_management", "billing_inquiry");

        model.addIntent(new IntentDefinition("account_management", "Updated", List.of()));

        assertEquals(List.of("account_management", "billing_inquiry", "greeting"),
            model.intents().stream().map(IntentDefinition::getName).toList());
        assertEquals(List.of("billing_inquiry"), model.findIntent("account_management").get().getChildIntents());
    }

    @Test
    void examplesAndEmbeddingsMustLineUp() {
        IntentDefinition greeting = model.findIntent("greeting").get();

        assertThrows(IllegalArgumentException.class,
            () -> greeting.replaceExamples(List.of("hi", "hello"), List.of(new float[] {1f})));
        assertThrows(IllegalArgumentException.class,
            () -> greeting.replaceExamples(List.of(""), List.of(new float[] {1f})));
        assertFalse(greeting.hasExamples());
    }
}
