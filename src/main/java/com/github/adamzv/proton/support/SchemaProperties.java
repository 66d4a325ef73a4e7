package com.github.adamzv.proton.support;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "schema")
public record SchemaProperties(
    String file,
    String packageName,
    String type,
    @DefaultValue("false")
    boolean indent
) {}
