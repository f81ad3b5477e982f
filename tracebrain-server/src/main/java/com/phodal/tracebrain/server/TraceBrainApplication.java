package com.phodal.tracebrain.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TraceBrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceBrainApplication.class, args);
    }
}
