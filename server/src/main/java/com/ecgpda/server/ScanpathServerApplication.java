package com.ecgpda.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScanpathServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanpathServerApplication.class, args);
    }
}
