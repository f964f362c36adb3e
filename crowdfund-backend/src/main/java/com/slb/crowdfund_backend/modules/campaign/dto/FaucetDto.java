package com.slb.crowdfund_backend.modules.campaign.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "开发环境充值请求体 / Dev faucet request body")
public class FaucetDto {

    @NotBlank(message = "账户不能为空")
    @Schema(description = "入账账户。/ Receiving holder.", example = "bob")
    private String holder;

    @NotNull(message = "数量不能为空")
    @Positive(message = "数量必须大于0")
    @Schema(description = "入账数量（最小单位整数）。/ Amount in base units.", type = "string", example = "5000000000000000000")
    private BigInteger amount;

    @Schema(description = "计价单位：NATIVE（默认）或 EXTERNAL。/ Denomination kind.", example = "NATIVE", allowableValues = {"NATIVE", "EXTERNAL"})
    private String denominationKind;

    @Schema(description = "外部代币标识。/ Token reference for EXTERNAL.", example = "usdc", nullable = true)
    private String tokenRef;
}
