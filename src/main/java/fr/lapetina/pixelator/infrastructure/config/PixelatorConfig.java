package fr.lapetina.pixelator.infrastructure.config;

/**
 * Root configuration object for the pixelator.
 * Designed to be populated from YAML.
 */
public class PixelatorConfig {

    private ConcurrencyConfig concurrency = new ConcurrencyConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private OutputConfig output = new OutputConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ConcurrencyConfig getConcurrency() { return concurrency; }
    public void setConcurrency(ConcurrencyConfig concurrency) { this.concurrency = concurrency; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Executor pool sizing.
     */
    public static class ConcurrencyConfig {
        public static final int FALLBACK_EXECUTORS = 4;

        /** 0 means "use the hardware parallelism hint" */
        private int maxExecutors = 0;
        private int fallbackExecutors = FALLBACK_EXECUTORS;

        public int getMaxExecutors() { return maxExecutors; }
        public void setMaxExecutors(int maxExecutors) { this.maxExecutors = maxExecutors; }

        public int getFallbackExecutors() { return fallbackExecutors; }
        public void setFallbackExecutors(int fallbackExecutors) { this.fallbackExecutors = fallbackExecutors; }

        /**
         * Default concurrency limit for calls that do not override it.
         */
        public int resolveDefaultExecutors() {
            if (maxExecutors > 0) {
                return maxExecutors;
            }
            int hint = Runtime.getRuntime().availableProcessors();
            if (hint > 0) {
                return hint;
            }
            return fallbackExecutors > 0 ? fallbackExecutors : FALLBACK_EXECUTORS;
        }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private String waitStrategy = "blocking";

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long callTimeoutMs = 60000;
        private long shutdownTimeoutMs = 5000;

        public long getCallTimeoutMs() { return callTimeoutMs; }
        public void setCallTimeoutMs(long callTimeoutMs) { this.callTimeoutMs = callTimeoutMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Defaults applied to calls that pass no options.
     */
    public static class OutputConfig {
        private boolean grayscale = false;

        public boolean isGrayscale() { return grayscale; }
        public void setGrayscale(boolean grayscale) { this.grayscale = grayscale; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "pixelator";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
