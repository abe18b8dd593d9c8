package com.github.dimitryivaniuta.photosearch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.photo-api")
public record PhotoApiProps(
        @DefaultValue("http://localhost:8081") @NotBlank String baseUrl,
        @DefaultValue("20")                    @Positive int    perPage,
        @DefaultValue("10s")                   Duration         timeout
) {}
