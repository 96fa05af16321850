package com.phillippitts.slawatch;

import com.phillippitts.slawatch.config.properties.IngestProperties;
import com.phillippitts.slawatch.config.properties.SlaProperties;
import com.phillippitts.slawatch.config.properties.TelemetryProperties;
import com.phillippitts.slawatch.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TelemetryProperties.class,
        IngestProperties.class,
        SlaProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class SlaWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlaWatchApplication.class, args);
    }

}
