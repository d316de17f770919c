package com.machining.kg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MachiningKgApplication {

    public static void main(String[] args) {
        SpringApplication.run(MachiningKgApplication.class, args);
    }
}
