package com.example.auditchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AuditChainApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditChainApplication.class, args);
    }
}
