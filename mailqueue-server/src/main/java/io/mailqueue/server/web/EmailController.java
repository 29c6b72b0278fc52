package io.mailqueue.server.web;

import io.mailqueue.EmailQueue;
import io.mailqueue.EnqueueResult;
import io.mailqueue.server.web.dto.AcceptedResponse;
import io.mailqueue.server.web.dto.DeadLetterResponse;
import io.mailqueue.server.web.dto.EmailRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Submission and dead-letter endpoints.
 */
@RestController
public class EmailController {

    private static final Logger log = LoggerFactory.getLogger(EmailController.class);

    private final EmailQueue queue;

    public EmailController(EmailQueue queue) {
        this.queue = queue;
    }

    /**
     * Queues an email for delivery.
     *
     * @param request validated submission
     * @return acknowledgement
     * @throws QueueUnavailableException if the queue is full or shutting down
     */
    @PostMapping("/send-email")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public AcceptedResponse sendEmail(@Valid @RequestBody EmailRequest request) {
        EnqueueResult result = queue.enqueue(request.toJob());
        if (!result.accepted()) {
            log.warn("Rejected email to {}: {}", request.to(), result);
            throw new QueueUnavailableException(result);
        }
        log.debug("Queued email to {}", request.to());
        return AcceptedResponse.queued();
    }

    @GetMapping("/dead-letter")
    public DeadLetterResponse deadLetters() {
        return DeadLetterResponse.of(queue.deadLetters());
    }
}
