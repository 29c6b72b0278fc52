package io.mailqueue.server.web.dto;

public record HealthResponse(String status, String service) {

    public static HealthResponse healthy() {
        return new HealthResponse("healthy", "email-queue");
    }
}
