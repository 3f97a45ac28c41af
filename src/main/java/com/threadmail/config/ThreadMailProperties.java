package com.threadmail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * ThreadMail configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "threadmail")
public class ThreadMailProperties {

    private Queue queue = new Queue();
    private Concurrency concurrency = new Concurrency();
    private Threading threading = new Threading();
    private Storage storage = new Storage();

    @Data
    public static class Queue {
        private String inboundDestination = "mail.inbound.queue";
        private String eventDestination = "thread.event.queue";
        private boolean publishEvents = true;
    }

    @Data
    public static class Concurrency {
        private int maxAttempts = 3;       // Load-mutate-save attempts before a conflict is rethrown
        private int lockStripes = 64;      // In-process locks shared by thread ids
    }

    @Data
    public static class Threading {
        private int candidateLimit = 20;   // Subject candidates tested per incoming message
    }

    @Data
    public static class Storage {
        private String dataDirectory = "data";
    }
}
