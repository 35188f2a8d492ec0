package com.csd.bizintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BizIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(BizIntelApplication.class, args);
    }
}
