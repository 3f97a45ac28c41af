package com.threadmail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * ThreadMail email thread aggregation service
 *
 * Groups incoming mail into conversations
 * - Thread aggregate with versioned, replayable event log
 * - MyBatis + SQLite persistence with optimistic locking
 * - ActiveMQ inbound mail queue and event queue
 * - Jakarta Mail message parsing
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.threadmail.mapper")
@EnableConfigurationProperties
public class ThreadMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreadMailApplication.class, args);
    }
}
