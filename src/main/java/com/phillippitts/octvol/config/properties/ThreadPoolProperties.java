package com.phillippitts.octvol.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the B-scan decode executor. Defaults are conservative
 * but can be adjusted based on hardware and typical volume size.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private DecodePoolProperties decode = new DecodePoolProperties();

    public DecodePoolProperties getDecode() {
        return decode;
    }

    public void setDecode(DecodePoolProperties decode) {
        this.decode = decode;
    }

    /**
     * Decode executor pool configuration.
     */
    public static class DecodePoolProperties {
        private int corePoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int maxPoolSize = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);
        private int queueCapacity = 256;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "vol-decode-";

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
    }
}
