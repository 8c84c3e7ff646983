package com.mathrok.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MathrokEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathrokEngineApplication.class, args);
    }
}
