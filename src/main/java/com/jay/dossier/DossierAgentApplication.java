package com.jay.dossier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DossierAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(DossierAgentApplication.class, args);
    }
}
