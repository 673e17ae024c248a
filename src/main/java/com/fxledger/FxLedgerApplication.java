package com.fxledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FxLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FxLedgerApplication.class, args);
    }
}
