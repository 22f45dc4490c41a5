package com.example.riskscan_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpeg) {
        return () -> {
            try {
                var p = new ProcessBuilder(ffmpeg, "-version").redirectErrorStream(true).start();
                p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
                if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                    return Health.up().withDetail("ffmpeg", "ok").build();
                }
                return Health.down().withDetail("ffmpeg", "exit " + p.exitValue()).build();
            } catch (Exception e) {
                if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            }
        };
    }

    @Bean
    public HealthIndicator reasoningHealth(@Qualifier("reasoningWebClient") WebClient reasoning) {
        return () -> {
            try {
                reasoning.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .onErrorResume(org.springframework.web.reactive.function.client.WebClientResponseException.class,
                                e -> reactor.core.publisher.Mono.empty())
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("reasoning", "reachable").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("reasoning", "unreachable").build();
            }
        };
    }
}
