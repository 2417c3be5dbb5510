package com.example.intent.classification;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.example.intent.config.CatalogProperties;
import com.example.intent.model.EntitySlot;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Seeds the classifier at startup from an intent catalog. {@code INTENT_CATALOG_FILE} points
 * at a file on disk; otherwise the configured classpath resource is read. Intents that fail to
 * embed are skipped, and a missing or broken catalog leaves the model empty.
 */
@Component
public class IntentCatalogLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IntentCatalogLoader.class);

    private final IntentClassifier classifier;
    private final CatalogProperties properties;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogFile(String version, List<CatalogIntent> intents) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogIntent(String name, String description, List<String> examples, List<String> aliases,
                         String parent, List<EntitySlot> entitySlots) {}

    public IntentCatalogLoader(IntentClassifier classifier, CatalogProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("Intent catalog loading disabled");
            return;
        }
        CatalogFile catalog = readCatalog();
        if (catalog == null || catalog.intents() == null || catalog.intents().isEmpty()) {
            return;
        }
        Integer loaded = load(catalog).block();
        log.info("Loaded intent catalog v{}: {} of {} intents", catalog.version(), loaded, catalog.intents().size());
    }

    CatalogFile readCatalog() {
        var objectMapper = new ObjectMapper();
        String catalogFile = System.getenv("INTENT_CATALOG_FILE");
        try {
            InputStream stream;
            if (catalogFile != null && Files.exists(Path.of(catalogFile))) {
                stream = Files.newInputStream(Path.of(catalogFile));
                log.info("Reading intent catalog from {}", catalogFile);
            } else {
                stream = getClass().getClassLoader().getResourceAsStream(properties.resource());
                if (stream == null) {
                    log.warn("No {} found on the classpath, starting with an empty intent model", properties.resource());
                    return null;
                }
                log.info("Reading intent catalog from classpath {}", properties.resource());
            }
            try (InputStream in = stream) {
                return objectMapper.readValue(in, CatalogFile.class);
            }
        } catch (IOException e) {
            log.warn("Failed to read intent catalog: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Adds every intent, then its aliases and parent links. Emits the number of intents added.
     */
    Mono<Integer> load(CatalogFile catalog) {
        return Flux.fromIterable(catalog.intents())
            .filter(intent -> intent.name() != null && !intent.name().isBlank())
            .concatMap(intent -> Mono.defer(() -> classifier.addIntent(intent.name(), intent.description(),
                    intent.examples() != null ? intent.examples() : List.of(), intent.entitySlots()))
                .onErrorResume(e -> {
                    log.warn("Skipping catalog intent '{}': {}", intent.name(), e.getMessage());
                    return Mono.empty();
                }))
            .count()
            .map(added -> {
                for (CatalogIntent intent : catalog.intents()) {
                    linkAndAlias(intent);
                }
                return added.intValue();
            });
    }

    private void linkAndAlias(CatalogIntent intent) {
        if (intent.name() == null || classifier.getModel().findIntent(intent.name()).isEmpty()) {
            return;
        }
        if (intent.aliases() != null) {
            for (String alias : intent.aliases()) {
                try {
                    classifier.addAlias(alias, intent.name());
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping alias '{}' of intent '{}': {}", alias, intent.name(), e.getMessage());
                }
            }
        }
        if (intent.parent() != null && !intent.parent().isBlank()) {
            try {
                classifier.linkIntents(intent.parent(), intent.name());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping parent '{}' of intent '{}': {}", intent.parent(), intent.name(), e.getMessage());
            }
        }
    }
}
