package com.taskpilot.dispatch.api;

import com.taskpilot.core.health.HealthCheckService;
import com.taskpilot.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("all UP returns 200 with per-component detail")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent", HealthStatus.Status.UP, "Agent backend answers", Map.of("provider", "process")),
                new HealthStatus("todo", HealthStatus.Status.UP, "TODO file present", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.agent.metadata.provider").value("process"))
                .andExpect(jsonPath("$.components.todo.metadata").doesNotExist());
    }

    @Test
    @DisplayName("DEGRADED component keeps 200 but reports DEGRADED overall")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("checkpoint", HealthStatus.Status.DEGRADED, "Ledger unreadable", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.checkpoint.detail").value("Ledger unreadable"));
    }

    @Test
    @DisplayName("any DOWN component returns 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent", HealthStatus.Status.DOWN, "Agent backend does not answer", Map.of()),
                new HealthStatus("todo", HealthStatus.Status.DEGRADED, "TODO file missing", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }
}
