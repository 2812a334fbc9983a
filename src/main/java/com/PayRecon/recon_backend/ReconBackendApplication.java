package com.PayRecon.recon_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReconBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconBackendApplication.class, args);
    }
}
