package com.coinledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoinLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoinLedgerApplication.class, args);
    }
}
