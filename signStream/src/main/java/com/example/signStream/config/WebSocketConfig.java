package com.example.signStream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import com.example.signStream.websocket.VideoStreamWsHandler;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
	private final VideoStreamWsHandler handler;
	private final ConnectionProperties connectionProperties;

	public WebSocketConfig(VideoStreamWsHandler handler, ConnectionProperties connectionProperties) {
		this.handler = handler;
		this.connectionProperties = connectionProperties;
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(handler, "/ws/video").setAllowedOrigins("*");
	}

	// base64 frames are far larger than the container's 8KB default
	@Bean
	public ServletServerContainerFactoryBean createWebSocketContainer() {
		ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
		container.setMaxTextMessageBufferSize(connectionProperties.getMaxTextMessageBytes());
		container.setMaxBinaryMessageBufferSize(connectionProperties.getMaxTextMessageBytes());
		return container;
	}
}
