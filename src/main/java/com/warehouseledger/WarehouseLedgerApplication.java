package com.warehouseledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WarehouseLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarehouseLedgerApplication.class, args);
    }
}
