package com.archflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArchflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchflowApplication.class, args);
    }
}
