package io.mailqueue.server.web;

import io.mailqueue.server.web.dto.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.healthy();
    }
}
