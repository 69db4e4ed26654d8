package net.deckadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Deck analysis and card recommendation service.
 */
@SpringBootApplication
@EnableScheduling
public class DeckAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckAdvisorApplication.class, args);
    }
}
