package com.slb.crowdfund_backend.modules.campaign.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "份额转移请求体 / Share transfer request body")
public class TransferDto {

    @NotBlank(message = "转出账户不能为空")
    @Schema(description = "转出账户。/ Sender.", example = "bob")
    private String from;

    @NotBlank(message = "转入账户不能为空")
    @Schema(description = "转入账户。/ Receiver.", example = "carol")
    private String to;

    @NotNull(message = "数量不能为空")
    @PositiveOrZero(message = "数量不能为负")
    @Schema(description = "转移份额数量，允许为 0。/ Share amount, zero allowed.", type = "string", example = "500000000000000000")
    private BigInteger amount;
}
