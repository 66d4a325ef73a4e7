package com.github.adamzv.proton.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class StartupLogger implements ApplicationListener<ApplicationStartedEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final KafkaProperties kafkaProperties;
  private final FramingProperties framingProperties;
  private final Environment environment;

  public StartupLogger(KafkaProperties kafkaProperties, FramingProperties framingProperties,
                       Environment environment) {
    this.kafkaProperties = kafkaProperties;
    this.framingProperties = framingProperties;
    this.environment = environment;
  }

  @Override
  public void onApplicationEvent(ApplicationStartedEvent event) {
    String version = environment.getProperty("proton.version", "unknown");
    log.debug(
        "proton_started version={} bootstrapServers={} clientId={} framing={{maxTokenSize={}}}",
        version,
        kafkaProperties.brokerAddresses(),
        kafkaProperties.clientId(),
        framingProperties.maxTokenSize()
    );
  }
}
