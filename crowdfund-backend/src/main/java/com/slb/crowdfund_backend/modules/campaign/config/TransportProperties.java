package com.slb.crowdfund_backend.modules.campaign.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.transport")
@Data
public class TransportProperties {

    /**
     * 外部代币每笔转账扣除的手续费（基点），用于模拟收费代币；原生币不受影响。
     */
    private int tokenTransferFeeBips = 0;

    /**
     * 是否开放 /api/v1/custody/faucet（仅开发环境）。
     */
    private boolean faucetEnabled = false;
}
