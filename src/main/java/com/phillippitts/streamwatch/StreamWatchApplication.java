package com.phillippitts.streamwatch;

import com.phillippitts.streamwatch.config.properties.MonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(MonitorProperties.class)
public class StreamWatchApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(StreamWatchApplication.class, args);
        System.exit(SpringApplication.exit(context));
    }

}
