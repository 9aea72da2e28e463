package com.phillippitts.octvol.config;

import com.phillippitts.octvol.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.octvol.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used to decode B-scans in parallel.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool that decodes B-scan records.
     *
     * <p>Each task reads a disjoint byte range of the source buffer and fills a disjoint
     * result slot, so tasks need no coordination beyond completion.
     *
     * <p>Pool sizing configured via {@code threadpool.decode.*} properties:
     * <ul>
     *   <li>Core pool: default max(2, cpus)</li>
     *   <li>Max pool: default max(4, 2 * cpus)</li>
     *   <li>Queue: default 256 tasks (one per B-scan of a dense volume)</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the reading thread decodes the B-scan itself,
     * providing backpressure instead of failing.
     *
     * <p>MDC propagation: Copies the Log4j2 ThreadContext from the submitting thread to
     * the worker thread so per-file context survives the hop.
     *
     * @return Configured executor for B-scan decoding
     */
    @Bean(name = "decodeExecutor")
    public Executor decodeExecutor() {
        ThreadPoolProperties.DecodePoolProperties props = threadPoolProperties.getDecode();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new ThreadContextTaskDecorator());

        executor.initialize();
        return executor;
    }
}
