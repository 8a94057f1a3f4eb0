package org.caureq.caureqsensorhub;

import org.caureq.caureqsensorhub.config.AppProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(AppProps.class)
@EnableScheduling
public class CaureqSensorHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaureqSensorHubApplication.class, args);
    }

}
