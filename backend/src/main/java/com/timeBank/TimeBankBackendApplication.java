package com.timeBank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeBankBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeBankBackendApplication.class, args);
    }

}
