package org.nowstart.fundnav.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NavSyncExecutorConfig {

    // 배치 내 스킴 수집 워커 풀(전역 동시성 상한)
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService navFetchExecutor(NavSyncProperties navSyncProperties) {
        return Executors.newFixedThreadPool(
                Math.max(1, navSyncProperties.maxConcurrency()),
                namedThreads("nav-fetch-")
        );
    }

    // 비동기 동기화 실행 전용 단일 스레드
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService navSyncRunner() {
        return Executors.newSingleThreadExecutor(namedThreads("nav-sync-runner-"));
    }

    private ThreadFactory namedThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
