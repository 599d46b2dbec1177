package com.switchboard.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * switchboard:
 *   scheduler:
 *     max-workers: 4
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "switchboard.scheduler")
public class SchedulerProperties {

    private int maxWorkers = 4;

    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
}
