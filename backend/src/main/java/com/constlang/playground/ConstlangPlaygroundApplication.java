package com.constlang.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConstlangPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConstlangPlaygroundApplication.class, args);
    }
}
