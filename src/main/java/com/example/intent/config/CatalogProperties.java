package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.intent.catalog")
public record CatalogProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("intents.json") String resource
) {}
