package uk.gov.di.result.helpers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.result.services.ConfigurationService;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class ExecutorHelper {

    private static final Logger LOG = LogManager.getLogger(ExecutorHelper.class);

    private ExecutorHelper() {}

    public static Executor createDefaultExecutor(ConfigurationService configurationService) {
        int poolSize = configurationService.getAsyncResultPoolSize();
        if (poolSize <= 0) {
            LOG.info("Using common fork join pool for async results");
            return ForkJoinPool.commonPool();
        }
        LOG.info("Using fixed thread pool of size {} for async results", poolSize);
        var threadFactory =
                daemonThreadFactory(configurationService.getAsyncResultThreadNamePrefix());
        return Executors.newFixedThreadPool(poolSize, threadFactory);
    }

    static ThreadFactory daemonThreadFactory(String namePrefix) {
        var threadCount = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, namePrefix + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
