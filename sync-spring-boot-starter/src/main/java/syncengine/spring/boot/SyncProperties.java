package syncengine.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the sync engine.
 *
 * @see SyncAutoConfiguration
 */
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    /**
     * Whether to create the {@code SyncEngine} bean.
     */
    private boolean enabled = true;

    /**
     * Maximum wait in milliseconds for each collaborator call.
     */
    private long callTimeoutMs = 10000;

    /**
     * Delay in milliseconds before resubscribing after a channel error.
     */
    private long resubscribeDelayMs = 5000;

    private final Batch batch = new Batch();
    private final Queue queue = new Queue();
    private final Health health = new Health();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public long getResubscribeDelayMs() {
        return resubscribeDelayMs;
    }

    public void setResubscribeDelayMs(long resubscribeDelayMs) {
        this.resubscribeDelayMs = resubscribeDelayMs;
    }

    public Batch getBatch() {
        return batch;
    }

    public Queue getQueue() {
        return queue;
    }

    public Health getHealth() {
        return health;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Batch {
        private int size = 10;
        private long intervalMs = 1000;
        private int workerCount = 4;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }
    }

    public static class Queue {
        private int maxLength = 1000;
        private long dedupWindowMs = 5000;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }

        public long getDedupWindowMs() {
            return dedupWindowMs;
        }

        public void setDedupWindowMs(long dedupWindowMs) {
            this.dedupWindowMs = dedupWindowMs;
        }
    }

    public static class Health {
        private long intervalMs = 60000;
        private long syncTimeoutMs = 30000;
        private int maxRetryAttempts = 3;
        private long clientIdleTimeoutMs = 300000;
        private double errorRateThreshold = 0.10;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getSyncTimeoutMs() {
            return syncTimeoutMs;
        }

        public void setSyncTimeoutMs(long syncTimeoutMs) {
            this.syncTimeoutMs = syncTimeoutMs;
        }

        public int getMaxRetryAttempts() {
            return maxRetryAttempts;
        }

        public void setMaxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
        }

        public long getClientIdleTimeoutMs() {
            return clientIdleTimeoutMs;
        }

        public void setClientIdleTimeoutMs(long clientIdleTimeoutMs) {
            this.clientIdleTimeoutMs = clientIdleTimeoutMs;
        }

        public double getErrorRateThreshold() {
            return errorRateThreshold;
        }

        public void setErrorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
        }
    }

    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;

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
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "sync";

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
