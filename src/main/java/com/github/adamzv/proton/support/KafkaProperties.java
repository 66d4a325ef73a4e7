package com.github.adamzv.proton.support;

import jakarta.validation.constraints.NotBlank;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka")
public record KafkaProperties(
    @NotBlank(message = "kafka.bootstrapServers must not be blank")
    @DefaultValue("localhost:9092")
    String bootstrapServers,
    @NotBlank(message = "kafka.clientId must not be blank")
    @DefaultValue("proton-consumer")
    String clientId
) {

  static final String DEFAULT_PORT = "9092";

  /**
   * Broker addresses as the Kafka client expects them: no URL scheme and an explicit port.
   */
  public String brokerAddresses() {
    return Arrays.stream(bootstrapServers.split(","))
        .map(String::trim)
        .filter(address -> !address.isEmpty())
        .map(KafkaProperties::normalize)
        .collect(Collectors.joining(","));
  }

  private static String normalize(String address) {
    int scheme = address.indexOf("://");
    String hostPort = scheme >= 0 ? address.substring(scheme + 3) : address;
    if (hostPort.endsWith("/")) {
      hostPort = hostPort.substring(0, hostPort.length() - 1);
    }
    boolean bracketedIpv6 = hostPort.startsWith("[");
    boolean hasPort = bracketedIpv6 ? hostPort.contains("]:") : hostPort.contains(":");
    return hasPort ? hostPort : hostPort + ":" + DEFAULT_PORT;
  }
}
