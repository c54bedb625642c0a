package com.al.shopsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ShopSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShopSyncApplication.class, args);
    }

}
