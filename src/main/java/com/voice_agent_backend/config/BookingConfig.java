package com.voice_agent_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tools.booking")
@Data
public class BookingConfig {

    private int openHour = 9;
    private int closeHour = 17;
    private int slotMinutes = 30;
    private int defaultDurationMinutes = 30;
    private int maxListedAppointments = 10;
}
