package com.github.dimitryivaniuta.photosearch.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient pointed at the upstream photo API; response timeout from {@link PhotoApiProps}.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient photoApiWebClient(WebClient.Builder builder, PhotoApiProps props) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.timeout().toMillis())
                .responseTimeout(props.timeout());
        return builder
                .baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
