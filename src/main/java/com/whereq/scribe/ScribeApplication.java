package com.whereq.scribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Scribe.
 * Accepts audio uploads over REST, queues them, and lets background workers
 * hand them to a speech-to-text engine while clients poll or watch job status.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class ScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScribeApplication.class, args);
    }
}
