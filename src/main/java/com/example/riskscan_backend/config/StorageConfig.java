package com.example.riskscan_backend.config;

import com.example.riskscan_backend.service.LocalStorageService;
import com.example.riskscan_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        LOGGER.info("Storage wired: base={}, raw={}, out={}, work={}",
                base, properties.getRawPrefix(), properties.getOutPrefix(), properties.getWorkPrefix());
        return new LocalStorageService(base, properties.getRawPrefix(), properties.getOutPrefix(), properties.getWorkPrefix());
    }
}
