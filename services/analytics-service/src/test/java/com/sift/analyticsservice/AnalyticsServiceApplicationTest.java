package com.sift.analyticsservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sift.analytics.Analytics;
import com.sift.analyticsservice.config.AnalyticsProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Analytics Service Application")
class AnalyticsServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads with analytics disabled")
    void contextLoads() {
        assertThat(context.getBean(Analytics.class).isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Analytics properties are loaded from test profile")
    void propertiesAreLoaded() {
        var props = context.getBean(AnalyticsProperties.class);
        assertThat(props.serviceName()).isEqualTo("sift-test");
        assertThat(props.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Analytics info endpoint reports the disabled state")
    void analyticsInfoEndpoint() throws Exception {
        mockMvc.perform(get("/api/v1/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false))
                .andExpect(jsonPath("$.serviceName").value("sift-test"))
                .andExpect(jsonPath("$.flushInterval").value("PT1H"));
    }

    @Test
    @DisplayName("Actuator health endpoint is available")
    void actuatorHealthEndpointIsAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
