package com.aporkolab.dlq.spring.autoconfigure;

import com.aporkolab.dlq.alerting.AlertChannel;
import com.aporkolab.dlq.alerting.AlertConfig;
import com.aporkolab.dlq.alerting.DlqAlerter;
import com.aporkolab.dlq.amqp.AmqpMessagePublisher;
import com.aporkolab.dlq.classify.NonRetryableRegistry;
import com.aporkolab.dlq.config.DlqConfig;
import com.aporkolab.dlq.kafka.KafkaDeadLetterForwarder;
import com.aporkolab.dlq.kafka.KafkaMessagePublisher;
import com.aporkolab.dlq.kafka.KafkaRetryingMessageListener;
import com.aporkolab.dlq.metrics.DlqMetrics;
import com.aporkolab.dlq.middleware.MiddlewareChain;
import com.aporkolab.dlq.middleware.RetryListener;
import com.aporkolab.dlq.middleware.RetryMiddleware;
import com.aporkolab.dlq.poison.PoisonMessageDetector;
import com.aporkolab.dlq.replay.DeadLetterReplayer;
import com.aporkolab.dlq.transport.MessagePublisher;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring Boot Auto-Configuration for the DLQ retry engine.
 *
 * Automatically configures:
 * - DlqConfig bound from {@code dlq.*} properties
 * - Non-retryable registry and poison message detector
 * - Kafka or AMQP message publisher, picked by {@code dlq.transport}
 * - RetryMiddleware, middleware chain and dead letter replayer
 * - DLQ metrics when a MeterRegistry is present
 * - Log/webhook alerting when the alerting module is on the classpath
 *
 * Every component backs off when the application defines its own bean.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration",
        "org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(DlqProperties.class)
public class DlqAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DlqAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public DlqConfig dlqConfig(DlqProperties properties) {
        DlqConfig config = properties.toDlqConfig();
        log.info("DLQ retry engine configured: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public NonRetryableRegistry nonRetryableRegistry() {
        return new NonRetryableRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "dlq.poison", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PoisonMessageDetector poisonMessageDetector(DlqProperties properties) {
        var poison = properties.getPoison();
        return new PoisonMessageDetector(poison.getThreshold(), poison.getMaxEntries());
    }

    // ==================== KAFKA ====================

    @Configuration
    @ConditionalOnClass({KafkaTemplate.class, KafkaMessagePublisher.class})
    @ConditionalOnBean(KafkaTemplate.class)
    @ConditionalOnProperty(prefix = "dlq", name = "transport", havingValue = "kafka", matchIfMissing = true)
    static class KafkaTransportAutoConfiguration {

        // The retry wait blocks the consumer thread, so it has to finish before the group evicts it.
        KafkaTransportAutoConfiguration(DlqConfig dlqConfig, DlqProperties properties) {
            KafkaRetryingMessageListener.requireWaitWithinPollInterval(dlqConfig,
                    Duration.ofMillis(properties.getKafka().getMaxPollIntervalMs()));
        }

        @Bean
        @ConditionalOnMissingBean(MessagePublisher.class)
        public KafkaMessagePublisher kafkaMessagePublisher(KafkaTemplate<String, String> kafkaTemplate,
                                                           DlqProperties properties) {
            return new KafkaMessagePublisher(kafkaTemplate,
                    Duration.ofMillis(properties.getKafka().getSendTimeoutMs()));
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(KafkaMessagePublisher.class)
        public KafkaDeadLetterForwarder kafkaDeadLetterForwarder(KafkaMessagePublisher publisher,
                                                                 ObjectProvider<ObjectMapper> objectMapper,
                                                                 DlqProperties properties) {
            ObjectMapper mapper = objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
            return new KafkaDeadLetterForwarder(publisher, mapper,
                    properties.getKafka().getDlqSuffix(), Clock.systemUTC());
        }
    }

    // ==================== AMQP ====================

    @Configuration
    @ConditionalOnClass({RabbitTemplate.class, AmqpMessagePublisher.class})
    @ConditionalOnBean(RabbitTemplate.class)
    @ConditionalOnProperty(prefix = "dlq", name = "transport", havingValue = "amqp")
    static class AmqpTransportAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean(MessagePublisher.class)
        public AmqpMessagePublisher amqpMessagePublisher(RabbitTemplate rabbitTemplate) {
            return new AmqpMessagePublisher(rabbitTemplate);
        }
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass({MeterRegistry.class, DlqMetrics.class})
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "dlq.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DlqMetrics dlqMetrics(MeterRegistry registry, DlqProperties properties,
                                     ObjectProvider<PoisonMessageDetector> poisonDetector) {
            DlqMetrics metrics = new DlqMetrics(registry, properties.getMetrics().getName());
            poisonDetector.ifAvailable(metrics::bindPoisonDetector);
            return metrics;
        }
    }

    // ==================== ALERTING ====================

    @Configuration
    @ConditionalOnClass(DlqAlerter.class)
    @ConditionalOnProperty(prefix = "dlq.alert", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class AlertingAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AlertConfig dlqAlertConfig(DlqProperties properties) {
            var alert = properties.getAlert();
            return AlertConfig.builder()
                    .enabled(alert.isEnabled())
                    .channels(toChannels(alert.getChannels()))
                    .webhookUrl(alert.getWebhookUrl())
                    .webhookTimeout(Duration.ofMillis(alert.getWebhookTimeoutMs()))
                    .rateLimit(Duration.ofSeconds(alert.getRateLimitSeconds()))
                    .warningThreshold(alert.getWarningThreshold())
                    .criticalThreshold(alert.getCriticalThreshold())
                    .includeMessagePreview(alert.isIncludeMessagePreview())
                    .maxPreviewLength(alert.getMaxPreviewLength())
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public DlqAlerter dlqAlerter(AlertConfig config) {
            return new DlqAlerter(config);
        }

        private static Set<AlertChannel> toChannels(Set<String> names) {
            if (names == null || names.isEmpty()) {
                return EnumSet.noneOf(AlertChannel.class);
            }
            return names.stream()
                    .map(name -> AlertChannel.valueOf(name.trim().toUpperCase(Locale.ROOT)))
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(AlertChannel.class)));
        }
    }

    // ==================== RETRY ENGINE ====================

    @Configuration
    @ConditionalOnBean(MessagePublisher.class)
    static class RetryEngineAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RetryMiddleware retryMiddleware(MessagePublisher publisher,
                                               DlqConfig config,
                                               NonRetryableRegistry registry,
                                               ObjectProvider<PoisonMessageDetector> poisonDetector,
                                               ObjectProvider<RetryListener> listeners) {
            return RetryMiddleware.builder(publisher, config)
                    .classifier(registry)
                    .poisonDetector(poisonDetector.getIfAvailable())
                    .listeners(listeners.orderedStream().collect(Collectors.toList()))
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public MiddlewareChain dlqMiddlewareChain(RetryMiddleware retryMiddleware) {
            return MiddlewareChain.of(retryMiddleware);
        }

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterReplayer deadLetterReplayer(MessagePublisher publisher,
                                                     DlqConfig config,
                                                     NonRetryableRegistry registry,
                                                     DlqProperties properties,
                                                     ObjectProvider<RetryListener> listeners) {
            return new DeadLetterReplayer(publisher, registry, config,
                    properties.getReplay().getMaxRetryCount(),
                    listeners.orderedStream().collect(Collectors.toList()));
        }
    }
}
