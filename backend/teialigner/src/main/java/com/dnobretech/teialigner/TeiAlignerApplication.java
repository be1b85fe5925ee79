package com.dnobretech.teialigner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TeiAlignerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeiAlignerApplication.class, args);
    }
}
