package com.conductor.dispatch.api;

import com.conductor.core.model.ServiceStatus;
import com.conductor.core.monitor.HealthMonitor;
import com.conductor.core.monitor.MonitorSettings;
import com.conductor.core.monitor.MonitorSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MonitorController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class MonitorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthMonitor healthMonitor;

    @Test
    @DisplayName("GET /monitor returns running flag, settings and services")
    void snapshot() throws Exception {
        when(healthMonitor.getStatus()).thenReturn(new MonitorSnapshot(true, MonitorSettings.defaults(),
                Map.of("db", new MonitorSnapshot.ServiceSnapshot(ServiceStatus.exited("db", 1), 2, true))));

        mockMvc.perform(get("/api/v1/monitor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.settings.checkIntervalMs").value(30000))
                .andExpect(jsonPath("$.services.db.status.status").value("exited"))
                .andExpect(jsonPath("$.services.db.status.exitCode").value(1))
                .andExpect(jsonPath("$.services.db.restartAttempts").value(2))
                .andExpect(jsonPath("$.services.db.scheduledForRestart").value(true));
    }

    @Test
    @DisplayName("POST /monitor/start starts polling")
    void start() throws Exception {
        when(healthMonitor.isRunning()).thenReturn(true);

        mockMvc.perform(post("/api/v1/monitor/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true));

        verify(healthMonitor).start();
    }

    @Test
    @DisplayName("POST /monitor/stop stops polling")
    void stop() throws Exception {
        mockMvc.perform(post("/api/v1/monitor/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false));

        verify(healthMonitor).stop();
    }

    @Test
    @DisplayName("PUT /monitor/settings applies a partial update")
    void partialUpdate() throws Exception {
        when(healthMonitor.getSettings()).thenReturn(MonitorSettings.defaults());

        mockMvc.perform(put("/api/v1/monitor/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"checkIntervalMs\": 5000, \"autoRestart\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkIntervalMs").value(5000))
                .andExpect(jsonPath("$.maxRestartAttempts").value(3));

        var captor = ArgumentCaptor.forClass(MonitorSettings.class);
        verify(healthMonitor).updateSettings(captor.capture());
        assertEquals(Duration.ofSeconds(5), captor.getValue().checkInterval());
        assertTrue(captor.getValue().autoRestart());
    }

    @Test
    @DisplayName("PUT /monitor/settings with an invalid value returns 400")
    void invalidUpdate() throws Exception {
        when(healthMonitor.getSettings()).thenReturn(MonitorSettings.defaults());

        mockMvc.perform(put("/api/v1/monitor/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"backoffMultiplier\": 0.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("backoffMultiplier must be at least 1.0"));

        verify(healthMonitor, never()).updateSettings(any());
    }
}
