package com.chargedesk.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * ChargeDesk chargeback case store.
 *
 * Runs one command from the command line ({@code init}, {@code seed}, {@code report})
 * against the embedded store and exits with the command's status.
 */
@SpringBootApplication(scanBasePackages = "com.chargedesk")
@EntityScan(basePackages = "com.chargedesk.core.domain")
@EnableJpaRepositories(basePackages = "com.chargedesk.core.repository")
public class ChargedeskApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ChargedeskApplication.class, args)));
    }
}
