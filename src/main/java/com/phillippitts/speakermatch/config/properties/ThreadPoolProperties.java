package com.phillippitts.speakermatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The scoring pool caps how many provider calls run at once. Size it to the provider's
 * concurrency allowance; requests with larger catalogs queue behind the running calls.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ScoringPoolProperties scoring = new ScoringPoolProperties();

    public ScoringPoolProperties getScoring() {
        return scoring;
    }

    public void setScoring(ScoringPoolProperties scoring) {
        this.scoring = scoring;
    }

    /**
     * Scoring executor pool configuration.
     */
    public static class ScoringPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 8;
        private int queueCapacity = 500;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "scoring-pool-";

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
