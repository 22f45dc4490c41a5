package com.example.riskscan_backend.config;

import com.example.riskscan_backend.util.Modality;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tick, retry and timeout settings of the analysis orchestrator.
 */
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private long tickMillis = 3000;
    private int batchSize = 10;
    private int executorThreads = 4;
    private int executorQueueCapacity = 100;

    /** Submissions per modality job, first attempt included. */
    private int maxAttempts = 3;
    private Duration backoffBase = Duration.ofSeconds(10);
    private Duration backoffMax = Duration.ofMinutes(5);
    private Duration pollInterval = Duration.ofSeconds(5);
    /** How long a submission claim blocks other invokers before it is considered abandoned. */
    private Duration claimLease = Duration.ofMinutes(2);
    /** Attempts of a request-level step (aggregation, fusion) on transient errors. */
    private int stepMaxAttempts = 3;

    private Timeouts timeouts = new Timeouts();

    public long getTickMillis() {
        return tickMillis;
    }

    public void setTickMillis(long tickMillis) {
        this.tickMillis = tickMillis;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getClaimLease() {
        return claimLease;
    }

    public void setClaimLease(Duration claimLease) {
        this.claimLease = claimLease;
    }

    public int getStepMaxAttempts() {
        return stepMaxAttempts;
    }

    public void setStepMaxAttempts(int stepMaxAttempts) {
        this.stepMaxAttempts = stepMaxAttempts;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    /**
     * Hard ceiling for a single submitted job, independent of what the provider reports.
     */
    public Duration timeoutFor(Modality modality) {
        return switch (modality) {
            case VISUAL -> timeouts.getVisual();
            case SPEECH -> timeouts.getSpeech();
            case SENTIMENT -> timeouts.getSentiment();
        };
    }

    public static class Timeouts {
        private Duration visual = Duration.ofMinutes(30);
        private Duration speech = Duration.ofMinutes(30);
        private Duration sentiment = Duration.ofMinutes(5);

        public Duration getVisual() {
            return visual;
        }

        public void setVisual(Duration visual) {
            this.visual = visual;
        }

        public Duration getSpeech() {
            return speech;
        }

        public void setSpeech(Duration speech) {
            this.speech = speech;
        }

        public Duration getSentiment() {
            return sentiment;
        }

        public void setSentiment(Duration sentiment) {
            this.sentiment = sentiment;
        }
    }
}
