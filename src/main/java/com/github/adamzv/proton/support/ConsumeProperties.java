package com.github.adamzv.proton.support;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "consume")
public record ConsumeProperties(
    String topic,
    @DefaultValue
    List<String> offsets,
    @DefaultValue(".*")
    String key,
    @DefaultValue("%Tf: %s")
    String format,
    @DefaultValue("false")
    boolean verbose
) {}
