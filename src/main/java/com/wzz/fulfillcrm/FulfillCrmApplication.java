package com.wzz.fulfillcrm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FulfillCrmApplication {

    public static void main(String[] args) {
        SpringApplication.run(FulfillCrmApplication.class, args);
    }

}
