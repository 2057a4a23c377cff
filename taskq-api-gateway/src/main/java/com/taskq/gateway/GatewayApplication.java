package com.taskq.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HTTP front end for producers. Shares the engine's store, codec and queue engine but never
 * runs workers, so the handler and worker packages are left out of the scan.
 */
@SpringBootApplication(scanBasePackages = {
        "com.taskq.gateway",
        "com.taskq.engine.config",
        "com.taskq.engine.store",
        "com.taskq.engine.service"
})
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
