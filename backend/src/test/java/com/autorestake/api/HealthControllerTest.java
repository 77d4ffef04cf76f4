package com.autorestake.api;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HealthControllerTest {

    @Test
    void reportsHealthyWithUptimeAndTimestamp() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC);
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController(clock)).build();

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.uptime").value(greaterThanOrEqualTo(0.0)))
                .andExpect(jsonPath("$.timestamp").value("2026-10-19T08:30:00Z"));
    }
}
