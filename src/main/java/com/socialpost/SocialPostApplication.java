package com.socialpost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SocialPostApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialPostApplication.class, args);
    }
}
