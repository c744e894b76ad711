package com.phillippitts.voicestream.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the executor that writes streaming HTTP responses.
 * Stream threads mostly block on the worker's output, so the pool is sized for
 * concurrency rather than CPU.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private StreamPoolProperties stream = new StreamPoolProperties();

    public StreamPoolProperties getStream() {
        return stream;
    }

    public void setStream(StreamPoolProperties stream) {
        this.stream = stream;
    }

    /**
     * Stream executor pool configuration.
     */
    public static class StreamPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "stream-pool-";
        /** Upper bound for one streaming response, in milliseconds. */
        private long asyncTimeoutMs = 600_000;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public long getAsyncTimeoutMs() {
            return asyncTimeoutMs;
        }

        public void setAsyncTimeoutMs(long asyncTimeoutMs) {
            this.asyncTimeoutMs = asyncTimeoutMs;
        }
    }
}
