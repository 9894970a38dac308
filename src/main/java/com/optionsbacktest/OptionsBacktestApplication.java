package com.optionsbacktest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionsBacktestApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionsBacktestApplication.class, args);
    }
}
