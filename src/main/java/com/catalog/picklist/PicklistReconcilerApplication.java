package com.catalog.picklist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PicklistReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PicklistReconcilerApplication.class, args);
    }
}
