package com.github.dimitryivaniuta.photosearch.config;

import com.github.dimitryivaniuta.photosearch.ws.SearchPhotoWsHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * Serves the search screen socket at {@link SearchPhotoWsHandler#PATH}, ahead of the annotated controllers.
 */
@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping photoSearchSocketMapping(SearchPhotoWsHandler photoSearchSocket) {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping();
        mapping.setUrlMap(Map.of(SearchPhotoWsHandler.PATH, photoSearchSocket));
        mapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter photoSearchSocketAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
