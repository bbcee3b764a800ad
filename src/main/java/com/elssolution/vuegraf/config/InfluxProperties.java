package com.elssolution.vuegraf.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter @Setter
@ToString(exclude = {"token", "pass"})
@ConfigurationProperties(prefix = "influx")
public class InfluxProperties {

    /** 1 or 2. */
    private int version = 2;
    private String url = "http://localhost:8086";

    // v2
    private String bucket;
    private String org;
    private String token;

    // v1
    private String database;
    private String user;
    private String pass;

    private boolean sslVerify = true;

    /** Delete all energy_usage data up to startup before polling begins. */
    private boolean reset = false;

    private int requestTimeoutMs = 10_000;
}
