package com.autorestake.config;

import com.autorestake.service.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@Slf4j
public class KeeperConfig {

    /**
     * Validated once; a bad configuration fails context startup before any chain client exists.
     */
    @Bean
    public RunConfig runConfig(KeeperProperties props) {
        RunConfig config = RunConfig.from(props);
        if (!config.cron().equals(props.getSchedule().getCron().trim())) {
            log.info("[keeper] 5-field cron '{}' normalized to '{}'", props.getSchedule().getCron().trim(), config.cron());
        }
        log.info("[keeper] configuration loaded: {}", config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public ThreadPoolTaskScheduler keeperTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // two threads so an overlapping cron fire can observe the run-lock instead of queueing
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("keeper-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
