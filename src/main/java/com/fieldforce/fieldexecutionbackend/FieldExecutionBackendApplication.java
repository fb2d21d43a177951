package com.fieldforce.fieldexecutionbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldExecutionBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldExecutionBackendApplication.class, args);
    }

}
