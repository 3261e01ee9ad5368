package com.phillippitts.lifecycle.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The dispatch pool runs event handlers, the subscriber pool runs status subscribers and the
 * validation pool runs status validators. They are separate so a handler or subscriber that
 * triggers a nested transition never waits on work stuck behind it in the same queue.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties dispatch = new PoolProperties(4, 8, 100, "dispatch-pool-");
    private PoolProperties subscriber = new PoolProperties(4, 8, 100, "subscriber-pool-");
    private PoolProperties validation = new PoolProperties(2, 4, 50, "validation-pool-");

    public PoolProperties getDispatch() {
        return dispatch;
    }

    public void setDispatch(PoolProperties dispatch) {
        this.dispatch = dispatch;
    }

    public PoolProperties getSubscriber() {
        return subscriber;
    }

    public void setSubscriber(PoolProperties subscriber) {
        this.subscriber = subscriber;
    }

    public PoolProperties getValidation() {
        return validation;
    }

    public void setValidation(PoolProperties validation) {
        this.validation = validation;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

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
