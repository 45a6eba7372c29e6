package com.knowledgeengine.main;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeEngineApplication.class, args);
    }
}
