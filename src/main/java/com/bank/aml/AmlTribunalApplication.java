package com.bank.aml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AmlTribunalApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmlTribunalApplication.class, args);
    }
}
