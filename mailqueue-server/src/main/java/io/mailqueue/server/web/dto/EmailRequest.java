package io.mailqueue.server.web.dto;

import io.mailqueue.EmailJob;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

/**
 * Body of {@code POST /send-email}.
 *
 * @param to      destination address
 * @param subject message subject
 * @param body    message body
 */
public record EmailRequest(
        @NotEmpty(message = EmailRequest.REQUIRED_MESSAGE)
        @Pattern(regexp = EmailRequest.ADDRESS_PATTERN, message = EmailRequest.INVALID_ADDRESS_MESSAGE)
        String to,
        @NotEmpty(message = EmailRequest.REQUIRED_MESSAGE) String subject,
        @NotEmpty(message = EmailRequest.REQUIRED_MESSAGE) String body) {

    public static final String ADDRESS_PATTERN = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$";
    public static final String REQUIRED_MESSAGE = "All fields (to, subject, body) are required";
    public static final String INVALID_ADDRESS_MESSAGE = "Invalid email format";

    public EmailJob toJob() {
        return new EmailJob(to, subject, body);
    }
}
