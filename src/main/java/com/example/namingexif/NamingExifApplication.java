package com.example.namingexif;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point.
 * Wires the naming plugin, the ExifTool adapter and the HTTP endpoints under the interfaces layer.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NamingExifApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(NamingExifApplication.class, args);
	}

}
