package com.voice_agent_backend.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Duration;

@Configuration
@Getter
public class VoiceAgentConfig {

    // Session rate limiting
    @Value("${voice.rate-limit.sessions-per-minute-per-agent:20}")
    private int sessionsPerMinutePerAgent;

    @Value("${voice.rate-limit.sessions-per-hour:1000}")
    private int sessionsPerHour;

    // Executor sizing: one gateway thread per live session, two pump threads per live session
    @Value("${voice.realtime.max-concurrent-sessions:50}")
    private int maxConcurrentSessions;

    @Bean
    public Bucket globalSessionRateLimitBucket() {
        Bandwidth limit = Bandwidth.classic(sessionsPerHour, Refill.intervally(sessionsPerHour, Duration.ofHours(1)));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    @Bean("realtimeSessionExecutor")
    public TaskExecutor realtimeSessionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(10, maxConcurrentSessions));
        executor.setMaxPoolSize(maxConcurrentSessions);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("RealtimeSession-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean("realtimePumpExecutor")
    public TaskExecutor realtimePumpExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(20, maxConcurrentSessions * 2));
        executor.setMaxPoolSize(maxConcurrentSessions * 2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("RealtimePump-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public WebSocketClient upstreamWebSocketClient() {
        return new StandardWebSocketClient();
    }
}
