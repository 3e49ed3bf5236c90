package com.vaultoracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultOracleApplication.class, args);
    }
}
