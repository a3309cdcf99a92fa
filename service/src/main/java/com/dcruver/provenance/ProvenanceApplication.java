package com.dcruver.provenance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Provenance.
 *
 * Captures context fragments (notes, transcripts, chat messages), extracts the
 * decisions and assumptions they contain, and links related fragments by
 * semantic similarity.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ProvenanceApplication {

    public static void main(String[] args) {
        log.info("Starting Provenance...");
        SpringApplication.run(ProvenanceApplication.class, args);
    }
}
