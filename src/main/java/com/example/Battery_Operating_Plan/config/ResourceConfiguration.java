package com.example.Battery_Operating_Plan.config;

import com.example.Battery_Operating_Plan.model.ResourceProfile;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration class for the Operating Plan service
 *
 * Provides the battery resource this instance plans for.
 * In a production environment, the profile would typically be loaded from the resource registration.
 */
@Configuration
public class ResourceConfiguration {

    /**
     * Default battery resource
     *
     * @return ResourceProfile bean with default values
     */
    @Bean
    public ResourceProfile resourceProfile() {
        return new ResourceProfile(
            "BESS_WEST_100MW",  // Resource name
            100.0,              // 100MW nameplate
            200.0,              // 200MWh (2 hour duration)
            0.86,               // Round-trip efficiency
            50.0,               // Ramp up MW/min
            50.0,               // Ramp down MW/min
            0.0,                // Min SOC MWh
            200.0,              // Max SOC MWh
            2.0                 // Auxiliary load MW
        );
    }

    /**
     * Wall clock used for the daily run start date and the submission cutoff
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
