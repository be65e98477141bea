package dev.coursecrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the catalog crawler.
 *
 * <p>Runs without a web server; unless {@code coursecrawl.dump.enabled=false}, startup dumps one
 * semester's catalog as JSON lines (see {@link dev.coursecrawl.cli.CatalogDumpRunner}).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseCrawlApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CourseCrawlApplication.class, args)));
    }
}
