package com.slb.crowdfund_backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 启用 Spring 的定时任务功能
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
