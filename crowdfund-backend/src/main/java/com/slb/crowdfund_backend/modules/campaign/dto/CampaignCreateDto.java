package com.slb.crowdfund_backend.modules.campaign.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;
import java.time.Instant;

@Data
@Schema(description = "创建众筹活动请求体 / Campaign creation request body")
public class CampaignCreateDto {

    @NotBlank(message = "收款方不能为空")
    @Schema(description = "结算成功后资金的收款方。/ Receiver of the pool on settlement.", example = "alice")
    private String recipient;

    @Schema(description = "手续费收取方，可选；为空时两项手续费必须为 0。/ Fee collector (optional; both fees must be 0 without one).", example = "treasury", nullable = true)
    private String feeCollector;

    @Min(value = 0, message = "手续费不能为负")
    @Max(value = 10000, message = "手续费基点不能超过 10000")
    @Schema(description = "结算时从资金池收取的手续费（基点，1 = 0.01%）。/ Upfront fee on the pool in bips.", example = "250")
    private int upfrontFeeBips;

    @Min(value = 0, message = "手续费不能为负")
    @Max(value = 10000, message = "手续费基点不能超过 10000")
    @Schema(description = "每次提取收益时收取的手续费（基点）。/ Fee on each yield withdrawal in bips.", example = "100")
    private int payoutFeeBips;

    @NotNull(message = "最低目标不能为空")
    @Positive(message = "最低目标必须大于0")
    @Schema(description = "最低募集目标（最小单位整数）。/ Minimum goal in base units.", type = "string", example = "5000000000000000000")
    private BigInteger goalMin;

    @NotNull(message = "募集上限不能为空")
    @Positive(message = "募集上限必须大于0")
    @Schema(description = "募集上限（最小单位整数）。/ Goal cap in base units.", type = "string", example = "10000000000000000000")
    private BigInteger goalMax;

    @NotNull(message = "单账户最低出资不能为空")
    @Positive(message = "单账户最低出资必须大于0")
    @Schema(description = "单账户累计出资下限。/ Per-account cumulative minimum.", type = "string", example = "1000000000000000")
    private BigInteger contributionMin;

    @NotNull(message = "单账户最高出资不能为空")
    @Positive(message = "单账户最高出资必须大于0")
    @Schema(description = "单账户累计出资上限。/ Per-account cumulative maximum.", type = "string", example = "2000000000000000000")
    private BigInteger contributionMax;

    @NotNull(message = "开始时间不能为空")
    @Schema(description = "出资窗口开始时间（含）。/ Window start, inclusive.", example = "2026-11-01T00:00:00Z")
    private Instant startsAt;

    @NotNull(message = "结束时间不能为空")
    @Schema(description = "出资窗口结束时间（不含）。/ Window end, exclusive.", example = "2026-12-01T00:00:00Z")
    private Instant endsAt;

    @Schema(description = "计价单位：NATIVE（原生币，默认）或 EXTERNAL（外部代币）。/ Denomination kind.", example = "NATIVE", allowableValues = {"NATIVE", "EXTERNAL"})
    private String denominationKind;

    @Schema(description = "外部代币标识，denominationKind=EXTERNAL 时必填。/ Token reference, required for EXTERNAL.", example = "usdc", nullable = true)
    private String tokenRef;
}
