package com.sift.analyticsservice.api;

import com.sift.analytics.Analytics;
import com.sift.analyticsservice.config.AnalyticsProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reports whether telemetry is collected and under which instance uid.
 */
@RestController
@RequestMapping("/api/v1")
public class AnalyticsInfoController {

    private final Analytics analytics;
    private final AnalyticsProperties properties;

    public AnalyticsInfoController(Analytics analytics, AnalyticsProperties properties) {
        this.analytics = analytics;
        this.properties = properties;
    }

    @GetMapping("/analytics")
    public Map<String, Object> analyticsInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("enabled", analytics.isEnabled());
        info.put("instanceUid", analytics.instanceUid().map(Object::toString).orElse(null));
        info.put("serviceName", properties.serviceName());
        info.put("version", properties.version());
        info.put("flushInterval", properties.flushInterval().toString());
        return info;
    }
}
