package com.payguard.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent entry point. The host registers the platform adapters as beans.
 */
@SpringBootApplication
public class PayguardAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayguardAgentApplication.class, args);
    }
}
