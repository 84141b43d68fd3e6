package com.fleetsync.sync.service;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /**
     * Master switch for startup and scheduled runs
     */
    private boolean enabled = true;

    private boolean startupEnabled = true;

    private boolean scheduledEnabled = true;

    /**
     * 6-field spring cron (second minute hour day month weekday)
     */
    private String cron = "0 0 2 * * *";

    /**
     * Cron timezone
     */
    private String zone = "UTC";

    /**
     * Calendar year to reconcile; empty means the current year in window-zone
     */
    private Integer targetYear;

    private String windowZone = "UTC";

    private Matching matching = new Matching();

    public ZoneId windowZoneId() {
        return windowZone == null || windowZone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(windowZone.trim());
    }

    @Getter
    @Setter
    public static class Matching {

        /**
         * Custom field groups tried in order before license plate and name matching.
         * A group matches when all of its fields are filled in and equal on both sides.
         */
        private Map<String, List<String>> customFieldGroups = defaultCustomFieldGroups();

        private static Map<String, List<String>> defaultCustomFieldGroups() {
            Map<String, List<String>> groups = new LinkedHashMap<>();
            groups.put("employee-number", List.of("employeenumber"));
            groups.put("fleet-number", List.of("fleetno"));
            return groups;
        }
    }
}
