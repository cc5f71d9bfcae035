package com.example.cachesync;

import com.example.cachesync.config.CacheSyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.kafka.annotation.EnableKafka;

@EnableKafka
@SpringBootApplication
@EnableConfigurationProperties(CacheSyncProperties.class)
public class CacheSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(CacheSyncApplication.class, args);
    }
}
