package io.mailqueue.server.web;

import io.mailqueue.EnqueueResult;
import io.mailqueue.server.web.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ErrorHandlingAdviceTest {

    private final ErrorHandlingAdvice advice = new ErrorHandlingAdvice();

    @Test
    void closedQueueMapsToServiceUnavailable() {
        ResponseEntity<ErrorResponse> response =
                advice.handleQueueUnavailable(new QueueUnavailableException(EnqueueResult.CLOSED));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("CLOSED", response.getBody().code());
        assertEquals("Service is shutting down", response.getBody().message());
    }

    @Test
    void unexpectedFailureMapsToInternalError() {
        ResponseEntity<ErrorResponse> response = advice.handleFallback(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().code());
    }
}
