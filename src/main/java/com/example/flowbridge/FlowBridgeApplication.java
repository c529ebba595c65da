package com.example.flowbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowBridgeApplication.class, args);
    }
}
