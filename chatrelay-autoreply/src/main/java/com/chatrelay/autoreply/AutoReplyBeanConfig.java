package com.chatrelay.autoreply;

import com.chatrelay.autoreply.backend.ReplyBackend;
import com.chatrelay.autoreply.backend.WebhookReplyBackend;
import com.chatrelay.autoreply.queue.ConversationQueue;
import com.chatrelay.channel.TriggerClassifier;
import com.chatrelay.channel.delivery.MessageDeliveryService;
import com.chatrelay.common.config.ConfigService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the auto-reply pipeline.
 */
@Configuration
public class AutoReplyBeanConfig {

    private final ConfigService configService;

    public AutoReplyBeanConfig(ConfigService configService) {
        this.configService = configService;
    }

    @Bean(destroyMethod = "close")
    public ConversationQueue conversationQueue() {
        return new ConversationQueue(configService.loadConfig().getQueue().getWorkerThreads());
    }

    @Bean
    public ReplyBackend replyBackend() {
        return new WebhookReplyBackend(configService.loadConfig().getBackend());
    }

    @Bean
    public AutoReplyDispatcher autoReplyDispatcher(TriggerClassifier classifier,
            ConversationQueue queue,
            ReplyBackend backend,
            MessageDeliveryService delivery) {
        return new AutoReplyDispatcher(classifier, queue, backend, delivery,
                configService.loadConfig().getReplies());
    }
}
