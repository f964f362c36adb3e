package com.slb.crowdfund_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 统一的业务时钟；出资窗口与失败判定都以它为准，测试中可替换为可控时钟。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.clock.zone:Asia/Shanghai}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
