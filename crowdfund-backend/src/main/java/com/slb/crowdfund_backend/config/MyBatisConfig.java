package com.slb.crowdfund_backend.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.slb.crowdfund_backend.modules.*.mapper")
public class MyBatisConfig {
}
