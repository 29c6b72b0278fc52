package io.mailqueue.server.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "mailqueue.workers=0",
        "mailqueue.queue-size=1",
        "mailqueue.shutdown-timeout=1s"
})
@AutoConfigureMockMvc
class QueueFullTest {

    private static final String BODY = "{\"to\":\"a@example.com\",\"subject\":\"Hi\",\"body\":\"b\"}";

    @Autowired
    private MockMvc mvc;

    @Test
    void fullQueueAnswersServiceUnavailable() throws Exception {
        mvc.perform(post("/send-email").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted());

        mvc.perform(post("/send-email").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("QUEUE_FULL"))
                .andExpect(jsonPath("$.message").value("Queue is full"));
    }
}
