package com.example.riskscan_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints of the external analysis capabilities.
 */
@ConfigurationProperties(prefix = "providers")
public class ProviderProperties {

    private Endpoint visual = new Endpoint("http://localhost:8091", 30);
    private Endpoint speech = new Endpoint("http://localhost:8092", 30);
    private Endpoint sentiment = new Endpoint("http://localhost:8093", 60);
    private Endpoint reasoning = new Endpoint("https://api.openai.com", 120);

    public Endpoint getVisual() {
        return visual;
    }

    public void setVisual(Endpoint visual) {
        this.visual = visual;
    }

    public Endpoint getSpeech() {
        return speech;
    }

    public void setSpeech(Endpoint speech) {
        this.speech = speech;
    }

    public Endpoint getSentiment() {
        return sentiment;
    }

    public void setSentiment(Endpoint sentiment) {
        this.sentiment = sentiment;
    }

    public Endpoint getReasoning() {
        return reasoning;
    }

    public void setReasoning(Endpoint reasoning) {
        this.reasoning = reasoning;
    }

    public static class Endpoint {
        private String baseUrl;
        private String apiKey;
        private String model;
        private long timeoutSeconds;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, long timeoutSeconds) {
            this.baseUrl = baseUrl;
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
