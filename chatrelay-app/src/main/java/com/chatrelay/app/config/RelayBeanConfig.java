package com.chatrelay.app.config;

import com.chatrelay.common.config.ConfigService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the shared configuration service.
 */
@Configuration
public class RelayBeanConfig {

    @Value("${chatrelay.config.path:~/.chatrelay/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }
}
