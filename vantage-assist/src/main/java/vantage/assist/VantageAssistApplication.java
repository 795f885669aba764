package vantage.assist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VantageAssistApplication {
    private static final Logger log = LoggerFactory.getLogger(VantageAssistApplication.class);

    public static void main(String[] args) {
        log.info("Starting vantage-assist");
        SpringApplication.run(VantageAssistApplication.class, args);
    }
}
