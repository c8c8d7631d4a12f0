package uk.gegc.contentunlock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentUnlockApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentUnlockApplication.class, args);
    }
}
