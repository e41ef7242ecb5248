package eu.virtualparadox.companion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompanionApplication {

    public static void main(final String[] args) {
        SpringApplication.run(CompanionApplication.class, args);
    }
}
