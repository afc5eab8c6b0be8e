package com.warden.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "warden.database")
public record DatabaseProperties(@DefaultValue("data/warden.db") String path) {}
