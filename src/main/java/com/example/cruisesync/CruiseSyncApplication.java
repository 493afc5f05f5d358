package com.example.cruisesync;

import com.example.cruisesync.common.config.AppFtpProperties;
import com.example.cruisesync.common.config.AppSyncProperties;
import com.example.cruisesync.common.config.AppWebhookProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.cruisesync.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppFtpProperties.class,
        AppSyncProperties.class,
        AppWebhookProperties.class
})
public class CruiseSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CruiseSyncApplication.class, args);
    }
}
