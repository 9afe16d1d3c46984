package com.chatrelay.channel.whatsapp;

import com.chatrelay.channel.InboundMessageHandler;
import com.chatrelay.channel.delivery.MessageDeliveryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Registers the WhatsApp HTTP routes using Spring MVC functional endpoints
 * (RouterFunction), so no @RestController is component-scanned.
 */
@Slf4j
@Configuration
public class WhatsAppWebhookRouterConfig {

    @Bean
    public WhatsAppWebhookController whatsAppWebhookController(WhatsAppInboundParser parser,
            InboundMessageHandler messageHandler,
            MessageDeliveryService deliveryService,
            WhatsAppBridgeOutboundAdapter bridge) {
        return new WhatsAppWebhookController(parser, messageHandler, deliveryService, bridge);
    }

    @Bean
    public RouterFunction<ServerResponse> whatsAppRoutes(WhatsAppWebhookController controller) {
        log.info("WhatsApp routes registered at /whatsapp/inbound, /send, /send-group, /groups");

        return RouterFunctions.route()
                .POST("/whatsapp/inbound", request -> toServerResponse(
                        controller.receiveUpsert(request.body(String.class))))
                .POST("/send", request -> toServerResponse(
                        controller.sendDirect(request.body(String.class))))
                .POST("/send-group", request -> toServerResponse(
                        controller.sendGroup(request.body(String.class))))
                .GET("/groups", request -> toServerResponse(controller.listGroups()))
                .build();
    }

    private static ServerResponse toServerResponse(ResponseEntity<?> entity) {
        ServerResponse.BodyBuilder builder = ServerResponse.status(entity.getStatusCode())
                .contentType(MediaType.APPLICATION_JSON);
        Object body = entity.getBody();
        return body != null ? builder.body(body) : builder.build();
    }
}
