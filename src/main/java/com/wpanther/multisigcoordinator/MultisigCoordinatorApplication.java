package com.wpanther.multisigcoordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MultisigCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultisigCoordinatorApplication.class, args);
    }
}
