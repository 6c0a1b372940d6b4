package com.opsdash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OpsDashApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsDashApplication.class, args);
    }
}
