package com.stabilityengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Stability Engine.
 *
 * The Stability Engine issues a value-pegged stable unit against native
 * collateral and a buffer unit that absorbs the collateral's surplus or
 * deficit, enforcing collateralization on every mint and redemption.
 */
@SpringBootApplication
public class StabilityEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(StabilityEngineApplication.class, args);
    }
}
