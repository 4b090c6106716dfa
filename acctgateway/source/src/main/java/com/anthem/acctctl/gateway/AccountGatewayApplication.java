package com.anthem.acctctl.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccountGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountGatewayApplication.class, args);
    }
}
