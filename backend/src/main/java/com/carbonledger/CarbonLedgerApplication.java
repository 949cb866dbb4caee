package com.carbonledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CarbonLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarbonLedgerApplication.class, args);
    }
}
