package dev.scriptorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Scriptorium corpus service.
 *
 * <p>Always serves the content, search and scheduler APIs. With {@code scriptorium.sync.enabled}
 * the same process also runs the desktop sync client against a (possibly remote) server.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScriptoriumApplication {
  public static void main(String[] args) {
    SpringApplication.run(ScriptoriumApplication.class, args);
  }
}
