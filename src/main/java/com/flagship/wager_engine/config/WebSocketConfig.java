package com.flagship.wager_engine.config;

import com.flagship.wager_engine.game.crash.CrashChannelHandler;
import com.flagship.wager_engine.game.slide.SlideChannelHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Game channels: {@code /ws/crash} and {@code /ws/slide}.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final CrashChannelHandler crashChannelHandler;
    private final SlideChannelHandler slideChannelHandler;

    @Value("${game.channel.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(crashChannelHandler, "/ws/crash").setAllowedOriginPatterns(allowedOrigins);
        registry.addHandler(slideChannelHandler, "/ws/slide").setAllowedOriginPatterns(allowedOrigins);
    }
}
