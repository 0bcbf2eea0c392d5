package com.phillippitts.radflow;

import com.phillippitts.radflow.config.properties.ActionQueueProperties;
import com.phillippitts.radflow.config.properties.AlertProperties;
import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.config.properties.DictationProperties;
import com.phillippitts.radflow.config.properties.ExternalAppProperties;
import com.phillippitts.radflow.config.properties.ReportProperties;
import com.phillippitts.radflow.config.properties.StudyPollerProperties;
import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ActionQueueProperties.class,
        DictationProperties.class,
        StudyPollerProperties.class,
        AlertProperties.class,
        ReportProperties.class,
        TextInsertionProperties.class,
        BindingProperties.class,
        ExternalAppProperties.class
})
@EnableScheduling
public class RadFlowApplication {

    public static void main(String[] args) {
        // Robot keystrokes and the system clipboard need a non-headless AWT toolkit
        new SpringApplicationBuilder(RadFlowApplication.class)
                .headless(false)
                .run(args);
    }

}
