package ai.classtalk.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the discussion monitoring backend.
 */
@SpringBootApplication
public class ClasstalkBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClasstalkBackendApplication.class, args);
    }
}
