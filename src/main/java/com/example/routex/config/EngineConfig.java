package com.example.routex.config;

import com.example.routex.service.delivery.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    // Shut down by TriggerScheduler.stop(), which must run before the store goes away
    @Bean(destroyMethod = "")
    public ExecutorService scheduleFireExecutor(@Value("${app.broadcast.fire-threads:4}") int fireThreads) {
        int threads = Math.max(1, fireThreads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "schedule-fire-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Schedule fire executor uses {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
