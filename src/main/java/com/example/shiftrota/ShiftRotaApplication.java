package com.example.shiftrota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShiftRotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShiftRotaApplication.class, args);
    }
}
