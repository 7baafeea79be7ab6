package org.nowstart.fundnav.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.Test;
import org.nowstart.fundnav.data.property.NavSyncPropertiesFixture;

class NavSyncExecutorConfigTest {

    private final NavSyncExecutorConfig config = new NavSyncExecutorConfig();

    @Test
    void navFetchExecutor_runsTasksOnNamedDaemonThreads() {
        ExecutorService executor = config.navFetchExecutor(NavSyncPropertiesFixture.defaults());
        try {
            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).join();

            assertThat(worker.getName()).startsWith("nav-fetch-");
            assertThat(worker.isDaemon()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void navSyncRunner_usesSingleNamedThread() {
        ExecutorService runner = config.navSyncRunner();
        try {
            String first = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), runner).join();
            String second = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), runner).join();

            assertThat(first).startsWith("nav-sync-runner-").isEqualTo(second);
        } finally {
            runner.shutdownNow();
        }
    }
}
