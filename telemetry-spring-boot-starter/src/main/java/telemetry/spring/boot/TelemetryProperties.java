package telemetry.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import telemetry.worker.RateLimitScope;

import java.time.Duration;

/**
 * Configuration properties for the telemetry pipeline.
 *
 * @see TelemetryAutoConfiguration
 */
@ConfigurationProperties(prefix = "telemetry")
public class TelemetryProperties {

    /**
     * Whether events are reported at all. Can be switched at runtime with
     * {@link telemetry.Telemetry#setEnabled(boolean)}.
     */
    private boolean enabled = true;

    /**
     * How long shutdown waits for the transport to flush.
     */
    private Duration flushTimeout = Duration.ofSeconds(2);

    private final Worker worker = new Worker();
    private final Bus bus = new Bus();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getFlushTimeout() {
        return flushTimeout;
    }

    public void setFlushTimeout(Duration flushTimeout) {
        this.flushTimeout = flushTimeout;
    }

    public Worker getWorker() {
        return worker;
    }

    public Bus getBus() {
        return bus;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int halfOpenMaxEvents = 3;
        private Duration rateLimitWindow = Duration.ofMinutes(1);
        private int rateLimitMaxEvents = 100;
        private RateLimitScope rateLimitScope = RateLimitScope.PER_COMPONENT;
        private double samplingRate = 1.0;
        private Duration slowThreshold = Duration.ofSeconds(5);
        private boolean batchingEnabled;
        private int batchSize = 10;
        private Duration batchTimeout = Duration.ofMillis(100);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getHalfOpenMaxEvents() {
            return halfOpenMaxEvents;
        }

        public void setHalfOpenMaxEvents(int halfOpenMaxEvents) {
            this.halfOpenMaxEvents = halfOpenMaxEvents;
        }

        public Duration getRateLimitWindow() {
            return rateLimitWindow;
        }

        public void setRateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = rateLimitWindow;
        }

        public int getRateLimitMaxEvents() {
            return rateLimitMaxEvents;
        }

        public void setRateLimitMaxEvents(int rateLimitMaxEvents) {
            this.rateLimitMaxEvents = rateLimitMaxEvents;
        }

        public RateLimitScope getRateLimitScope() {
            return rateLimitScope;
        }

        public void setRateLimitScope(RateLimitScope rateLimitScope) {
            this.rateLimitScope = rateLimitScope;
        }

        public double getSamplingRate() {
            return samplingRate;
        }

        public void setSamplingRate(double samplingRate) {
            this.samplingRate = samplingRate;
        }

        public Duration getSlowThreshold() {
            return slowThreshold;
        }

        public void setSlowThreshold(Duration slowThreshold) {
            this.slowThreshold = slowThreshold;
        }

        public boolean isBatchingEnabled() {
            return batchingEnabled;
        }

        public void setBatchingEnabled(boolean batchingEnabled) {
            this.batchingEnabled = batchingEnabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getBatchTimeout() {
            return batchTimeout;
        }

        public void setBatchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
        }
    }

    public static class Bus {
        private int workerCount = 2;
        private int queueCapacity = 1000;
        private Duration drainTimeout = Duration.ofSeconds(5);
        /** Window in which identical events are published once; 0 disables deduplication. */
        private Duration deduplicationTtl = Duration.ofMinutes(5);
        private int deduplicationMaxEntries = 1000;

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

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public Duration getDeduplicationTtl() {
            return deduplicationTtl;
        }

        public void setDeduplicationTtl(Duration deduplicationTtl) {
            this.deduplicationTtl = deduplicationTtl;
        }

        public int getDeduplicationMaxEntries() {
            return deduplicationMaxEntries;
        }

        public void setDeduplicationMaxEntries(int deduplicationMaxEntries) {
            this.deduplicationMaxEntries = deduplicationMaxEntries;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "telemetry";

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
