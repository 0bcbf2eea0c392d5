package com.phillippitts.radflow.config;

import com.phillippitts.radflow.util.Pause;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time sources shared by the action worker and the pollers. Tests construct components
 * directly with a controllable clock and a no-op pause.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Blocking pause used between steps of an external interaction.
     */
    @Bean
    public Pause pause() {
        return Pause.SLEEP;
    }
}
