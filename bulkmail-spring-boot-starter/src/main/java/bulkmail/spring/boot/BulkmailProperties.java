package bulkmail.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the bulk mail pipeline.
 *
 * @see BulkmailAutoConfiguration
 */
@ConfigurationProperties(prefix = "bulkmail")
public class BulkmailProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Workers workers = new Workers();
    private final Report report = new Report();
    private final Metrics metrics = new Metrics();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Workers getWorkers() {
        return workers;
    }

    public Report getReport() {
        return report;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Scheduler {
        /**
         * Whether the scheduler loop is started with the application context.
         */
        private boolean enabled = true;
        private long intervalMs = 60000;
        private int maxClaimsPerTick = 100;
        /**
         * Re-dispatch IN_PROGRESS campaigns on the first tick after startup.
         */
        private boolean resumeOnStart = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getMaxClaimsPerTick() {
            return maxClaimsPerTick;
        }

        public void setMaxClaimsPerTick(int maxClaimsPerTick) {
            this.maxClaimsPerTick = maxClaimsPerTick;
        }

        public boolean isResumeOnStart() {
            return resumeOnStart;
        }

        public void setResumeOnStart(boolean resumeOnStart) {
            this.resumeOnStart = resumeOnStart;
        }
    }

    public static class Workers {
        private int workerCount = 4;
        private int queueCapacity = 1000;
        private long sendTimeoutMs = 30000;
        private long drainTimeoutMs = 5000;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public long getSendTimeoutMs() {
            return sendTimeoutMs;
        }

        public void setSendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Report {
        /**
         * Recipient of completion reports. When unset, reports are only logged.
         */
        private String adminEmail;

        public String getAdminEmail() {
            return adminEmail;
        }

        public void setAdminEmail(String adminEmail) {
            this.adminEmail = adminEmail;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "bulkmail";

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
