package com.voice_agent_backend.models;

public enum AppointmentStatus {
    SCHEDULED,
    CANCELLED,
    COMPLETED
}
