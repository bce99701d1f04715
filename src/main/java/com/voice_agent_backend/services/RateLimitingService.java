package com.voice_agent_backend.services;

import com.voice_agent_backend.config.VoiceAgentConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
@Slf4j
public class RateLimitingService {

    private final VoiceAgentConfig voiceAgentConfig;

    // Per-agent session open buckets. Consume and cleanup both go through the map's per-key compute.
    private final ConcurrentMap<String, Bucket> agentBuckets = new ConcurrentHashMap<>();

    private final Bucket globalSessionBucket;

    public RateLimitingService(VoiceAgentConfig voiceAgentConfig,
                               @Qualifier("globalSessionRateLimitBucket") Bucket globalSessionBucket) {
        this.voiceAgentConfig = voiceAgentConfig;
        this.globalSessionBucket = globalSessionBucket;
    }

    /**
     * Consume one session open for the agent, then one from the global budget.
     */
    public void checkSessionOpen(String agentId) {
        if (agentId == null) {
            throw new IllegalArgumentException("Agent ID is required for rate limiting");
        }

        AtomicBoolean allowed = new AtomicBoolean();
        agentBuckets.compute(agentId, (id, bucket) -> {
            Bucket current = bucket != null ? bucket : createAgentBucket();
            allowed.set(current.tryConsume(1));
            return current;
        });
        if (!allowed.get()) {
            log.warn("Session rate limit exceeded for agent: {}", agentId);
            throw new RateLimitExceededException("rate limit exceeded", 60);
        }

        if (!globalSessionBucket.tryConsume(1)) {
            log.warn("Global session rate limit exceeded");
            throw new RateLimitExceededException("rate limit exceeded", 300);
        }
    }

    public Map<String, Object> getGlobalRateLimitStatus() {
        return Map.of(
                "globalSessionsAvailable", globalSessionBucket.getAvailableTokens(),
                "sessionsPerMinutePerAgent", voiceAgentConfig.getSessionsPerMinutePerAgent(),
                "activeAgentBuckets", agentBuckets.size()
        );
    }

    /**
     * Drop buckets that have refilled completely, i.e. agents with no recent session opens.
     */
    @Scheduled(fixedDelayString = "${voice.rate-limit.cleanup-interval-ms:300000}")
    public void cleanupInactiveBuckets() {
        int limit = voiceAgentConfig.getSessionsPerMinutePerAgent();
        for (String agentId : agentBuckets.keySet()) {
            agentBuckets.computeIfPresent(agentId,
                    (id, bucket) -> bucket.getAvailableTokens() >= limit ? null : bucket);
        }
        log.debug("Cleaned up rate limiting buckets. Active agents: {}", agentBuckets.size());
    }

    public void resetAgentRateLimit(String agentId) {
        agentBuckets.remove(agentId);
        log.info("Reset rate limits for agent: {}", agentId);
    }

    private Bucket createAgentBucket() {
        int sessionsPerMinute = voiceAgentConfig.getSessionsPerMinutePerAgent();
        Bandwidth limit = Bandwidth.classic(sessionsPerMinute,
                Refill.intervally(sessionsPerMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
