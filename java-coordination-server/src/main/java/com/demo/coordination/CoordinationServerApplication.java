package com.demo.coordination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoordinationServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinationServerApplication.class, args);
    }
}
