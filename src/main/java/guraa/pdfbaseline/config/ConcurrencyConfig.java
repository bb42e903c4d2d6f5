package guraa.pdfbaseline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool for scoring pages in parallel.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    /**
     * Task executor for comparing pages. Threads are daemons so a finished command
     * line run never waits on the pool.
     */
    @Bean(name = "comparisonExecutor", destroyMethod = "shutdown")
    public ExecutorService comparisonExecutor(AppProperties properties) {
        int threads = properties.getConcurrency().getComparisonThreads();
        if (threads < 1) {
            throw new ConfigException("app.concurrency.comparison-threads must be at least 1, got " + threads);
        }
        log.debug("Creating comparison executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, createThreadFactory("compare-"));
    }

    /**
     * Create a thread factory with proper naming and error handling.
     *
     * @param prefix Thread name prefix
     * @return A ThreadFactory
     */
    static ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setDaemon(true);
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));
                return thread;
            }
        };
    }
}
