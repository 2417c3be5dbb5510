package com.example.intent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.example.intent.config.AppConfig;
import com.example.intent.config.CatalogProperties;
import com.example.intent.config.ClassificationProperties;
import com.example.intent.config.ContextProperties;
import com.example.intent.config.DetectionProperties;
import com.example.intent.config.FallbackProperties;
import com.example.intent.config.ReasoningProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    AppConfig.class,
    ClassificationProperties.class,
    FallbackProperties.class,
    ReasoningProperties.class,
    ContextProperties.class,
    DetectionProperties.class,
    CatalogProperties.class
})
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
