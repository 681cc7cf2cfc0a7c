package com.gdin.inspection.gsw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GswApplication {

    public static void main(String[] args) {
        SpringApplication.run(GswApplication.class, args);
    }
}
