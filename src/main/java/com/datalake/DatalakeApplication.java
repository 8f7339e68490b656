package com.datalake;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Main application class for the data lake query service.
 *
 * Serves filtered, paginated and aggregated views over transaction records kept
 * in two storage backends:
 * - Parquet batch files grouped into collections under the data lake root
 * - tables in the relational store loaded from those batches
 *
 * The HTTP layer and authorization live in front of this service.
 */
@SpringBootApplication
public class DatalakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DatalakeApplication.class, args);
    }

    /**
     * Wall clock for time windows; "now" is read from it once per request
     */
    @Bean
    public Clock clock(@Value("${datalake.time.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
