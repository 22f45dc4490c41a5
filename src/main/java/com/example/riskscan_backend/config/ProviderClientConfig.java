package com.example.riskscan_backend.config;

import com.example.riskscan_backend.engine.HttpSentimentClient;
import com.example.riskscan_backend.engine.HttpSpeechClient;
import com.example.riskscan_backend.engine.HttpVisualEmotionClient;
import com.example.riskscan_backend.engine.OpenAIReasoningClient;
import com.example.riskscan_backend.engine.Interfaces.ReasoningClient;
import com.example.riskscan_backend.engine.Interfaces.SentimentClient;
import com.example.riskscan_backend.engine.Interfaces.SpeechClient;
import com.example.riskscan_backend.engine.Interfaces.VisualEmotionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per external capability, each with its own connection pool and timeouts.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean("visualWebClient")
    WebClient visualWebClient(ProviderProperties props) {
        return build("visual", props.getVisual());
    }

    @Bean("speechWebClient")
    WebClient speechWebClient(ProviderProperties props) {
        return build("speech", props.getSpeech());
    }

    @Bean("sentimentWebClient")
    WebClient sentimentWebClient(ProviderProperties props) {
        return build("sentiment", props.getSentiment());
    }

    @Bean("reasoningWebClient")
    WebClient reasoningWebClient(ProviderProperties props) {
        return build("reasoning", props.getReasoning());
    }

    @Bean
    VisualEmotionClient visualEmotionClient(@Qualifier("visualWebClient") WebClient client, ObjectMapper om, ProviderProperties props) {
        return new HttpVisualEmotionClient(client, om, Duration.ofSeconds(props.getVisual().getTimeoutSeconds()));
    }

    @Bean
    SpeechClient speechClient(@Qualifier("speechWebClient") WebClient client, ObjectMapper om, ProviderProperties props) {
        return new HttpSpeechClient(client, om, Duration.ofSeconds(props.getSpeech().getTimeoutSeconds()));
    }

    @Bean
    SentimentClient sentimentClient(@Qualifier("sentimentWebClient") WebClient client, ObjectMapper om, ProviderProperties props) {
        return new HttpSentimentClient(client, om, Duration.ofSeconds(props.getSentiment().getTimeoutSeconds()));
    }

    @Bean
    ReasoningClient reasoningClient(@Qualifier("reasoningWebClient") WebClient client, ObjectMapper om, ProviderProperties props) {
        return new OpenAIReasoningClient(client, om,
                Duration.ofSeconds(props.getReasoning().getTimeoutSeconds()),
                props.getReasoning().getModel());
    }

    private WebClient build(String name, ProviderProperties.Endpoint endpoint) {
        Duration timeout = Duration.ofSeconds(Math.max(1, endpoint.getTimeoutSeconds()));
        ConnectionProvider provider = ConnectionProvider.builder(name + "-http")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS)));

        LOGGER.info("Configuring {} WebClient baseUrl={} timeout={}s maxConn={}", name, endpoint.getBaseUrl(), timeout.toSeconds(), MAX_CONNECTIONS);

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(endpoint.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024));
        if (endpoint.getApiKey() != null && !endpoint.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + endpoint.getApiKey().trim());
        }
        return builder.build();
    }
}
