package com.github.dimitryivaniuta.photosearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PhotoSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoSearchApplication.class, args);
    }
}
