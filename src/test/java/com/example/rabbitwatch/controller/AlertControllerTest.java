package com.example.rabbitwatch.controller;

import com.example.rabbitwatch.alerting.AlertDetectionService;
import com.example.rabbitwatch.alerting.AlertFilter;
import com.example.rabbitwatch.alerting.AlertQueryService;
import com.example.rabbitwatch.alerting.HealthCheckService;
import com.example.rabbitwatch.config.AppConfig;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.AlertSummary;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.exception.GlobalExceptionHandler;
import com.example.rabbitwatch.exception.PermissionDeniedException;
import com.example.rabbitwatch.exception.ResourceNotFoundException;
import com.example.rabbitwatch.exception.ThresholdValidationException;
import com.example.rabbitwatch.service.NotificationSettingsService;
import com.example.rabbitwatch.service.PlanService;
import com.example.rabbitwatch.service.ThresholdService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

    private static final String BASE = "/api/workspaces/ws-1";

    @Mock private AlertQueryService alertQueryService;
    @Mock private AlertDetectionService detectionService;
    @Mock private HealthCheckService healthCheckService;
    @Mock private ThresholdService thresholdService;
    @Mock private PlanService planService;
    @Mock private NotificationSettingsService notificationSettingsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AlertController controller = new AlertController(alertQueryService, detectionService, healthCheckService,
                thresholdService, planService, notificationSettingsService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .build();
    }

    @Test
    @DisplayName("Listing alerts without a vhost is a bad request")
    void alertsRequireVhost() throws Exception {
        mockMvc.perform(get(BASE + "/servers/srv-1/alerts"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"))
                .andExpect(jsonPath("$.message").value("Missing required parameter: vhost"));

        verifyNoInteractions(alertQueryService);
    }

    @Test
    @DisplayName("Query parameters become the alert filter")
    void alertsFilterIsParsed() throws Exception {
        when(alertQueryService.getServerAlerts(eq("ws-1"), eq("srv-1"), any())).thenReturn(
                new AlertQueryService.ServerAlerts(List.of(), AlertSummary.empty(), ThresholdSet.defaults(), 0,
                        Instant.parse("2026-03-01T12:00:00Z")));

        mockMvc.perform(get(BASE + "/servers/srv-1/alerts")
                        .param("vhost", "/")
                        .param("severity", "critical")
                        .param("limit", "10")
                        .param("offset", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0))
                .andExpect(jsonPath("$.thresholds.memory.warning").value(80.0))
                .andExpect(jsonPath("$.timestamp").value("2026-03-01T12:00:00Z"));

        verify(alertQueryService).getServerAlerts("ws-1", "srv-1",
                new AlertFilter(AlertSeverity.CRITICAL, null, null, "/", 10, 0));
    }

    @Test
    @DisplayName("An unknown severity is rejected")
    void unknownSeverity() throws Exception {
        mockMvc.perform(get(BASE + "/servers/srv-1/alerts").param("vhost", "/").param("severity", "loud"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown severity: loud"));
    }

    @Test
    @DisplayName("Checking an unknown server is not found")
    void checkUnknownServer() throws Exception {
        when(alertQueryService.requireServer("ws-1", "nope")).thenThrow(new ResourceNotFoundException("Server", "nope"));

        mockMvc.perform(post(BASE + "/servers/nope/alerts/check"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));

        verifyNoInteractions(detectionService);
    }

    @Test
    @DisplayName("Thresholds come with the plan's permission and the defaults")
    void getThresholds() throws Exception {
        when(thresholdService.getThresholds("ws-1")).thenReturn(ThresholdSet.defaults());
        when(thresholdService.getDefaults()).thenReturn(ThresholdSet.defaults());
        when(planService.canModifyThresholds("ws-1")).thenReturn(false);

        mockMvc.perform(get(BASE + "/thresholds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canModify").value(false))
                .andExpect(jsonPath("$.thresholds.disk.warning").value(15.0))
                .andExpect(jsonPath("$.defaults.consumerUtilization.warning").value(10.0))
                .andExpect(jsonPath("$.defaults.consumerUtilization.critical").doesNotExist());
    }

    @Test
    @DisplayName("A plan without threshold access is forbidden")
    void updateThresholdsForbidden() throws Exception {
        when(thresholdService.updateThresholds(eq("ws-1"), any()))
                .thenThrow(new PermissionDeniedException("Your plan does not allow custom thresholds"));

        mockMvc.perform(put(BASE + "/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"thresholds\":{\"memory\":{\"warning\":70}}}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("forbidden"));
    }

    @Test
    @DisplayName("Invalid thresholds list the offending metrics")
    void updateThresholdsInvalid() throws Exception {
        when(thresholdService.updateThresholds(eq("ws-1"), any())).thenThrow(new ThresholdValidationException(
                List.of("memory"), List.of("memory: warning (96.0) must be below critical (95.0)")));

        mockMvc.perform(put(BASE + "/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"thresholds\":{\"memory\":{\"warning\":96}}}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("validation_failed"))
                .andExpect(jsonPath("$.details.metrics[0]").value("memory"))
                .andExpect(jsonPath("$.details.violations.length()").value(1));
    }

    @Test
    @DisplayName("Accepted thresholds are echoed back")
    void updateThresholds() throws Exception {
        ThresholdSet updated = ThresholdSet.defaults();
        when(thresholdService.updateThresholds(eq("ws-1"), any())).thenReturn(updated);

        mockMvc.perform(put(BASE + "/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"thresholds\":{\"memory\":{\"warning\":70}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Alert thresholds updated"))
                .andExpect(jsonPath("$.thresholds.memory.critical").value(95.0));

        verify(planService).requireWorkspace("ws-1");
    }

    @Test
    @DisplayName("Changing alert settings requires a caller")
    void alertSettingsRequireCaller() throws Exception {
        mockMvc.perform(put(BASE + "/alert-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"emailNotificationsEnabled\":false}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required header: X-User-Id"));

        verifyNoInteractions(notificationSettingsService);
    }
}
