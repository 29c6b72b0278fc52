package io.mailqueue.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HTTP front end for the email queue.
 */
@SpringBootApplication
public class MailQueueServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailQueueServerApplication.class, args);
    }
}
