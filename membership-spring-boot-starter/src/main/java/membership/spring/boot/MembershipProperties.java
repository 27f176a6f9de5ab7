package membership.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the membership engine.
 *
 * @see MembershipAutoConfiguration
 */
@ConfigurationProperties(prefix = "membership")
public class MembershipProperties {

    /**
     * Group addresses new members join and expired members leave.
     */
    private List<String> groups = new ArrayList<>();

    /**
     * Prefix of the membership tables.
     */
    private String tablePrefix = "membership_";

    private final Queue queue = new Queue();
    private final Retry retry = new Retry();
    private final Scheduler scheduler = new Scheduler();
    private final Metrics metrics = new Metrics();

    public List<String> getGroups() {
        return groups;
    }

    public void setGroups(List<String> groups) {
        this.groups = groups;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Queue getQueue() {
        return queue;
    }

    public Retry getRetry() {
        return retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Queue {
        private int batchSize = 50;
        private int maxAttempts = 5;
        private Duration triggerInterval = Duration.ofMinutes(1);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getTriggerInterval() {
            return triggerInterval;
        }

        public void setTriggerInterval(Duration triggerInterval) {
            this.triggerInterval = triggerInterval;
        }
    }

    public static class Retry {
        private long baseDelayMs = 60_000;
        private long maxDelayMs = 86_400_000;
        private double jitter = 0.1;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private long intervalSeconds = 900;
        private long initialDelaySeconds = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public long getInitialDelaySeconds() {
            return initialDelaySeconds;
        }

        public void setInitialDelaySeconds(long initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "membership";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
