package com.voice_agent_backend.models;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "agents")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Agent {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "pricing_tier", nullable = false, length = 20)
    private String pricingTier;

    @Column(name = "system_prompt", columnDefinition = "TEXT")
    private String systemPrompt;

    @Column(length = 10)
    @Builder.Default
    private String language = "en-US";

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "agent_enabled_tools", joinColumns = @JoinColumn(name = "agent_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "tool_name", length = 100)
    @Builder.Default
    private List<String> enabledTools = new ArrayList<>();

    @Column(name = "enable_recording", nullable = false)
    @Builder.Default
    private Boolean enableRecording = false;

    @Column(name = "enable_transcript", nullable = false)
    @Builder.Default
    private Boolean enableTranscript = true;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
