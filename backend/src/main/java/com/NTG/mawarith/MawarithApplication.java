package com.NTG.mawarith;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MawarithApplication {

    public static void main(String[] args) {
        SpringApplication.run(MawarithApplication.class, args);
    }
}
