package com.dnsfilter.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DNS filter proxy API application.
 *
 * Authenticates realm tokens, authorizes DNS changes against realm and
 * domain-root policy, and forwards permitted changes to a DNS backend.
 */
@SpringBootApplication(scanBasePackages = "com.dnsfilter")
@EntityScan(basePackages = "com.dnsfilter.core.domain")
@EnableJpaRepositories(basePackages = "com.dnsfilter.core.repository")
@EnableScheduling
public class DnsFilterApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(DnsFilterApiApplication.class, args);
    }
}
