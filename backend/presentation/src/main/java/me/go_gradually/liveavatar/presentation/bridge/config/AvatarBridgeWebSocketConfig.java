package me.go_gradually.liveavatar.presentation.bridge.config;

import me.go_gradually.liveavatar.presentation.bridge.websocket.AvatarBridgeWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class AvatarBridgeWebSocketConfig implements WebSocketConfigurer {
    private final AvatarBridgeWebSocketHandler avatarBridgeWebSocketHandler;

    public AvatarBridgeWebSocketConfig(AvatarBridgeWebSocketHandler avatarBridgeWebSocketHandler) {
        this.avatarBridgeWebSocketHandler = avatarBridgeWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(avatarBridgeWebSocketHandler, "/ws/*")
                .setAllowedOriginPatterns("*");
    }

    // 오디오 청크와 SDP가 한 프레임에 들어가도록 버퍼를 키운다.
    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(1_048_576);
        container.setMaxBinaryMessageBufferSize(1_048_576);
        return container;
    }
}
