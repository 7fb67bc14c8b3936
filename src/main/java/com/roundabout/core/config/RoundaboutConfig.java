package com.roundabout.core.config;

import com.roundabout.core.time.ScheduledExecutorTimerService;
import com.roundabout.core.time.TimerService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time, randomness and thread-pool beans shared by the governor and agents.
 */
@Configuration
public class RoundaboutConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new Random();
    }

    @Bean(destroyMethod = "shutdown")
    public TimerService timerService() {
        return new ScheduledExecutorTimerService();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "roundabout-agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
