package com.example.bankletter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankLetterApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankLetterApplication.class, args);
    }
}
