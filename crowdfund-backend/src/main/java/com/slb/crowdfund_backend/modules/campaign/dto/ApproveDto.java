package com.slb.crowdfund_backend.modules.campaign.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "份额授权请求体 / Share allowance request body")
public class ApproveDto {

    @NotBlank(message = "持有人不能为空")
    @Schema(description = "份额持有人。/ Share owner.", example = "bob")
    private String owner;

    @NotBlank(message = "被授权方不能为空")
    @Schema(description = "被授权方。/ Spender.", example = "market")
    private String spender;

    @NotNull(message = "授权数量不能为空")
    @PositiveOrZero(message = "授权数量不能为负")
    @Schema(description = "授权额度（覆盖原额度）。/ Allowance, replaces any previous value.", type = "string", example = "1000000000000000000")
    private BigInteger amount;
}
