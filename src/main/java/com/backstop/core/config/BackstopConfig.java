package com.backstop.core.config;

import com.backstop.core.scheduler.MainThreadDispatcher;
import com.backstop.core.scheduler.ScheduledMainThreadDispatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class BackstopConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single daemon thread for crash record enrichment.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService enrichmentExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-enrichment");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "close")
    public MainThreadDispatcher mainThreadDispatcher() {
        return new ScheduledMainThreadDispatcher();
    }
}
