package com.autobal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutobalApplication {

    private static final Logger log = LoggerFactory.getLogger(AutobalApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AutobalApplication.class, args);
        log.info("BAL trough analysis service started.");
        log.info("Analyse:  POST http://localhost:8080/epochs  (batch: POST /epochs/batch)");
        log.info("Metrics:  GET  http://localhost:8080/metrics?sourceId=<id>&fromMjd=<mjd>&toMjd=<mjd>");
        log.info("Status:   GET  http://localhost:8080/status");
        log.info("Health:   GET  http://localhost:8080/actuator/health");
    }
}
