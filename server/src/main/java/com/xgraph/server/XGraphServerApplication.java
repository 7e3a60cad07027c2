package com.xgraph.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XGraphServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(XGraphServerApplication.class, args);
    }
}
