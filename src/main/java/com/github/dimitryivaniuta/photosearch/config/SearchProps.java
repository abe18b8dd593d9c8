package com.github.dimitryivaniuta.photosearch.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * @param debounceWindow quiet period before a typed keyword is searched; {@code 0} searches every
 *                       keyword the consumer picks up
 * @param maxSessions    upper bound on concurrently open screen sessions
 */
@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProps(
        @DefaultValue("0ms")  Duration debounceWindow,
        @DefaultValue("1000") @Positive int maxSessions
) {}
