package io.mailqueue.server.web.dto;

import io.mailqueue.dead.DeadLetter;

import java.util.List;

/**
 * Contents of the dead-letter log.
 *
 * @param count number of dead letters
 * @param jobs  dead letters, oldest first
 */
public record DeadLetterResponse(int count, List<DeadLetter> jobs) {

    public static DeadLetterResponse of(List<DeadLetter> jobs) {
        return new DeadLetterResponse(jobs.size(), jobs);
    }
}
