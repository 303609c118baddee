package com.gdin.inspection.graphalgo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GraphAlgoApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphAlgoApplication.class, args);
    }
}
