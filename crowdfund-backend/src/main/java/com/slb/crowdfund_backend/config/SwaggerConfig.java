package com.slb.crowdfund_backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("众筹活动后端服务 API / SLB Crowdfund Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                1. 基本信息 / Basic Information
                                - API 名称 / API Name: 众筹活动后端服务 API (SLB Crowdfund Backend API)
                                - 版本号 / Version: 1.0.0
                                
                                API 介绍 / API Introduction:
                                本服务管理众筹活动的完整生命周期：出资、结算或失败判定、份额（1:1 对应净出资）转移，
                                以及结算后按份额比例分配的收益与手续费。
                                This service manages the full lifecycle of fundraising campaigns: contributions, settlement or
                                failure, transferable 1:1 shares, and pro-rata yield distribution with fees after settlement.
                                
                                2. 数值约定 / Numeric Conventions
                                - 所有数量均为最小单位整数（如 wei），响应中以十进制字符串返回，请求中可传字符串或数字。
                                  All amounts are integer base units, returned as decimal strings; requests accept strings or numbers.
                                - 手续费以基点（bips）表示，1 bip = 0.01%，向下取整。
                                  Fees are expressed in basis points and rounded down.
                                
                                统一返回结构 / Unified Response Envelope:
                                所有接口（成功或异常）统一包裹在 ApiResponse<T> 结构中：
                                - code: 业务状态码，0 表示成功，非 0 与 HTTP 状态码一致。
                                - message: 提示信息，成功为 "ok"，错误时为具体原因。
                                - error.code: 稳定机器码，如 CAMPAIGN_WINDOW / CAMPAIGN_STATE / CAMPAIGN_BOUNDS / CAMPAIGN_BALANCE。
                                - traceId: 请求链路追踪 ID，便于排查问题。
                                
                                异常约定 / Error Handling:
                                - CAMPAIGN_CONFIG(400)：活动参数不合法；
                                - CAMPAIGN_WINDOW(409)：不在允许的时间窗口内；
                                - CAMPAIGN_STATE(409)：当前状态不允许该操作；
                                - CAMPAIGN_BOUNDS(422)：超出出资上下限或募集上限；
                                - CAMPAIGN_BALANCE(422)：无可提取余额、份额或授权不足；
                                - CAMPAIGN_TRANSPORT(502)：资金划转失败，操作已整体回滚。
                                """
                        )
                        .contact(new Contact()
                                .name("Hyperion")
                                .email("backend@slb.xyz")
                        )
                );
    }
}
