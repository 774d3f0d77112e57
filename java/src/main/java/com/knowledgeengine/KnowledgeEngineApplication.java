package com.knowledgeengine;

import com.knowledgeengine.config.KnowledgeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Knowledge Engine Server Application
 *
 * Typed knowledge graph store with cost-bounded traversal and an
 * LRU-governed active context, served over Spring Boot WebFlux.
 */
@SpringBootApplication
@EnableConfigurationProperties(KnowledgeProperties.class)
public class KnowledgeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeEngineApplication.class, args);
    }

}
