package uk.gov.di.result.helpers;

import org.junit.jupiter.api.Test;
import uk.gov.di.result.services.ConfigurationService;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutorHelperTest {

    private final ConfigurationService configurationService = mock(ConfigurationService.class);

    @Test
    void shouldUseTheCommonPoolWhenNoPoolSizeIsConfigured() {
        when(configurationService.getAsyncResultPoolSize()).thenReturn(0);

        var executor = ExecutorHelper.createDefaultExecutor(configurationService);

        assertThat(executor, sameInstance(ForkJoinPool.commonPool()));
        verify(configurationService, never()).getAsyncResultThreadNamePrefix();
    }

    @Test
    void shouldCreateANamedDaemonPoolWhenAPoolSizeIsConfigured() {
        when(configurationService.getAsyncResultPoolSize()).thenReturn(2);
        when(configurationService.getAsyncResultThreadNamePrefix()).thenReturn("test-pool-");

        var executor = ExecutorHelper.createDefaultExecutor(configurationService);

        try {
            assertThat(executor, instanceOf(ExecutorService.class));
            var thread =
                    CompletableFuture.supplyAsync(Thread::currentThread, executor).join();
            assertThat(thread.getName(), startsWith("test-pool-"));
            assertTrue(thread.isDaemon());
        } finally {
            ((ExecutorService) executor).shutdownNow();
        }
    }

    @Test
    void daemonThreadFactoryShouldNumberThreads() {
        var factory = ExecutorHelper.daemonThreadFactory("worker-");

        var first = factory.newThread(() -> {});
        var second = factory.newThread(() -> {});

        assertThat(first.getName(), equalTo("worker-1"));
        assertThat(second.getName(), equalTo("worker-2"));
    }
}
