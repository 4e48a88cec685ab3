package com.apsentinel.detection.health;

import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.apsentinel.detection.trace.TraceIdFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HealthzController.class)
class HealthzControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void healthzReportsServiceAndEchoesTrace() throws Exception {
        mockMvc.perform(get("/healthz").header(TraceIdFilter.TRACE_HEADER, "lb-check-1"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "lb-check-1"))
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("detection-svc"));
    }

    @Test
    void unsafeTraceHeaderIsReplaced() throws Exception {
        mockMvc.perform(get("/healthz").header(TraceIdFilter.TRACE_HEADER, "abc\r\nFAKE LOG LINE"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER,
                        matchesPattern("[0-9a-f-]{36}")));
    }
}
