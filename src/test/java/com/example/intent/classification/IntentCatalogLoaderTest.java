package com.example.intent.classification;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.intent.config.CatalogProperties;
import com.example.intent.config.ClassificationProperties;
import com.example.intent.context.ConversationContextStore;
import com.example.intent.llm.StubLlmProvider;
import com.example.intent.telemetry.IntentMetrics;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class IntentCatalogLoaderTest {

    private final StubLlmProvider llm = new StubLlmProvider()
        .embedding("question about my account", 1f, 0f)
        .embedding("my invoice", 0.9f, 0.1f)
        .embedding("hi", 0f, 1f);

    private final IntentClassifier classifier = new IntentClassifier(llm, (ConversationContextStore) null,
        ClassificationProperties.defaults(), new IntentMetrics());

    private final IntentCatalogLoader loader = new IntentCatalogLoader(classifier,
        new CatalogProperties(true, "intents.json"));

    @Test
    void loadsIntentsAliasesAndParents() {
        var catalog = new IntentCatalogLoader.CatalogFile("1", List.of(
            new IntentCatalogLoader.CatalogIntent("account_management", "Account questions",
                List.of("question about my account"), List.of(), null, null),
            new IntentCatalogLoader.CatalogIntent("billing_inquiry", "Invoices",
                List.of("my invoice"), List.of("billing", "invoices"), "account_management", null),
            new IntentCatalogLoader.CatalogIntent("greeting", "Hello",
                List.of("hi"), List.of("hello_intent"), null, null)));

        StepVerifier.create(loader.load(catalog))
            .expectNext(3)
            .verifyComplete();

        assertEquals("billing_inquiry", classifier.resolveIntentName("invoices"));
        assertEquals("greeting", classifier.resolveIntentName("hello_intent"));
        assertEquals("account_management",
            classifier.getModel().findIntent("billing").get().getParentIntent());
    }

    @Test
    void skipsIntentsThatFailToEmbed() {
        var catalog = new IntentCatalogLoader.CatalogFile("1", List.of(
            new IntentCatalogLoader.CatalogIntent("weather", "Forecasts",
                List.of("will it rain"), List.of("forecast"), null, null),
            new IntentCatalogLoader.CatalogIntent("greeting", "Hello",
                List.of("hi"), List.of(), "weather", null),
            new IntentCatalogLoader.CatalogIntent(" ", "nameless", List.of("hi"), List.of(), null, null)));

        StepVerifier.create(loader.load(catalog))
            .expectNext(1)
            .verifyComplete();

        assertEquals(1, classifier.getModel().size());
        assertNull(classifier.getModel().findIntent("greeting").get().getParentIntent());
        assertThrows(IllegalArgumentException.class, () -> classifier.resolveIntentName("forecast"));
    }

    @Test
    void readsBundledCatalog() {
        IntentCatalogLoader.CatalogFile catalog = loader.readCatalog();

        assertNotNull(catalog);
        assertTrue(catalog.intents().stream().anyMatch(i -> i.name().equals("cancel_subscription")));
        assertTrue(catalog.intents().stream()
            .filter(i -> i.name().equals("cancel_subscription"))
            .allMatch(i -> i.entitySlots().size() == 1 && "plan".equals(i.entitySlots().get(0).name())));
    }

    @Test
    void missingResourceGivesNoCatalog() {
        IntentCatalogLoader missing = new IntentCatalogLoader(classifier,
            new CatalogProperties(true, "no-such-catalog.json"));

        if (System.getenv("INTENT_CATALOG_FILE") == null) {
            assertNull(missing.readCatalog());
        }
    }
}
