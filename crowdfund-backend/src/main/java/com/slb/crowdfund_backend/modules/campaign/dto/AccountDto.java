package com.slb.crowdfund_backend.modules.campaign.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "提取请求体 / Withdrawal request body")
public class AccountDto {

    @NotBlank(message = "账户不能为空")
    @Schema(description = "提取账户。/ Withdrawing account.", example = "bob")
    private String account;
}
