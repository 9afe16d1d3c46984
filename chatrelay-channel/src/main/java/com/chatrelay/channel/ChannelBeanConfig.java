package com.chatrelay.channel;

import com.chatrelay.channel.delivery.MessageDeliveryService;
import com.chatrelay.channel.whatsapp.WhatsAppBridgeOutboundAdapter;
import com.chatrelay.channel.whatsapp.WhatsAppInboundParser;
import com.chatrelay.common.config.ConfigService;
import com.chatrelay.common.config.RelayConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for Channel beans.
 */
@Slf4j
@Configuration
public class ChannelBeanConfig {

    private final ConfigService configService;

    public ChannelBeanConfig(ConfigService configService) {
        this.configService = configService;
    }

    @Bean
    public TriggerClassifier triggerClassifier() {
        TriggerRules rules = TriggerRules.fromConfig(configService.loadConfig().getTrigger());
        log.info("Trigger rules: {} name alias(es), {} numeric alias(es), commands {}",
                rules.nameAliases().size(), rules.numberAliases().size(), rules.commandPrefixes());
        return new TriggerClassifier(rules);
    }

    @Bean
    public WhatsAppBridgeOutboundAdapter whatsAppBridgeOutboundAdapter() {
        return new WhatsAppBridgeOutboundAdapter(configService.loadConfig().getBridge());
    }

    @Bean
    public MessageDeliveryService messageDeliveryService(WhatsAppBridgeOutboundAdapter bridge) {
        RelayConfig.BridgeConfig bridgeConfig = configService.loadConfig().getBridge();
        MessageDeliveryService service = new MessageDeliveryService();
        service.registerAdapter(bridge, bridgeConfig.getMaxTextLength());
        return service;
    }

    @Bean
    public WhatsAppInboundParser whatsAppInboundParser() {
        return new WhatsAppInboundParser();
    }
}
