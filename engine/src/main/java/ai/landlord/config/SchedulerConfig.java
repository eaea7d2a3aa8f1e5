package ai.landlord.config;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared scheduler for AI "thinking" delays, turn timeouts and table cleanup.
 * <p>
 * Scheduled tasks never touch table state themselves; they only submit actions to the owning
 * table's mailbox.
 */
@Configuration
public class SchedulerConfig {

    @Bean(name = "tableScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService tableScheduler() {
        return newTableScheduler();
    }

    /**
     * Builds the scheduler outside a Spring context (tests, the offline runner).
     */
    public static ScheduledExecutorService newTableScheduler() {
        int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "table-timer-" + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        });
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }
}
