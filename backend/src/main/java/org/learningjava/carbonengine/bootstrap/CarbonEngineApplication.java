package org.learningjava.carbonengine.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.carbonengine")
public class CarbonEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(CarbonEngineApplication.class, args);
    }
}
