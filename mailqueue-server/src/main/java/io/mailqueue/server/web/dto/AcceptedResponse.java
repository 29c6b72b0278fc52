package io.mailqueue.server.web.dto;

/**
 * Acknowledgement for an accepted submission.
 *
 * @param status  always {@code "accepted"}
 * @param message human readable message
 */
public record AcceptedResponse(String status, String message) {

    public static AcceptedResponse queued() {
        return new AcceptedResponse("accepted", "Email queued for processing");
    }
}
