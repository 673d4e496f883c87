package com.jewelrec.main;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JewelryRecommenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(JewelryRecommenderApplication.class, args);
    }
}
