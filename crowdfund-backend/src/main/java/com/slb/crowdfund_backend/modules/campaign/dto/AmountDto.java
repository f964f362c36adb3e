package com.slb.crowdfund_backend.modules.campaign.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * 出资与注入收益共用的请求体：从 account 划入 amount。
 */
@Data
@Schema(description = "账户 + 数量请求体（出资 / 注入收益）/ Account and amount request body (contribute, deposit yield)")
public class AmountDto {

    @NotBlank(message = "账户不能为空")
    @Schema(description = "付款账户。/ Paying account.", example = "bob")
    private String account;

    @NotNull(message = "数量不能为空")
    @Positive(message = "数量必须大于0")
    @Schema(description = "划入数量（最小单位整数）。/ Amount in base units.", type = "string", example = "1000000000000000000")
    private BigInteger amount;
}
