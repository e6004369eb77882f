package com.trustplatform.response;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrustEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustEngineApplication.class, args);
    }
}
