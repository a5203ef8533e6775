package com.example.shiftrota.admin;

import com.example.shiftrota.common.error.ErrorLogBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @BeforeEach
    void setUp() {
        errorLogBuffer.clear();
    }

    @Test
    void errorLogs_areListedNewestFirstAndCleared() throws Exception {
        errorLogBuffer.addError("GET /api/teams/1/schedule", new IllegalStateException("a"));
        errorLogBuffer.addError("POST /api/teams/2/schedule/repair", new IllegalStateException("b"));

        mockMvc.perform(get("/api/admin/error-logs").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.count").value(1))
            .andExpect(jsonPath("$.data.items[0].request").value("POST /api/teams/2/schedule/repair"))
            .andExpect(jsonPath("$.data.items[0].teamId").value(2));

        mockMvc.perform(delete("/api/admin/error-logs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.cleared").value(2));

        assertThat(errorLogBuffer.recent()).isEmpty();
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("UP"));
    }
}
