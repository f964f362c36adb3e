package com.slb.crowdfund_backend.modules.campaign.controller;

import com.slb.crowdfund_backend.common.api.ApiResponse;
import com.slb.crowdfund_backend.common.vo.PageVo;
import com.slb.crowdfund_backend.modules.campaign.dto.AccountDto;
import com.slb.crowdfund_backend.modules.campaign.dto.AmountDto;
import com.slb.crowdfund_backend.modules.campaign.dto.ApproveDto;
import com.slb.crowdfund_backend.modules.campaign.dto.CampaignCreateDto;
import com.slb.crowdfund_backend.modules.campaign.dto.TransferDto;
import com.slb.crowdfund_backend.modules.campaign.dto.TransferFromDto;
import com.slb.crowdfund_backend.modules.campaign.service.CampaignService;
import com.slb.crowdfund_backend.modules.campaign.vo.AccountVo;
import com.slb.crowdfund_backend.modules.campaign.vo.AllowanceVo;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignLedgerVo;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignVo;
import com.slb.crowdfund_backend.modules.campaign.vo.ContributionRangeVo;
import com.slb.crowdfund_backend.modules.campaign.vo.OperationResultVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("api/v1/campaigns")
@Tag(name = "众筹活动", description = "活动创建、出资、结算/失败判定、收益注入与提取、份额转移等接口")
@Slf4j
public class CampaignController {

    private final CampaignService campaignService;

    public CampaignController(CampaignService campaignService) {
        this.campaignService = campaignService;
    }

    @PostMapping
    @Operation(
            summary = "创建活动",
            description = """
                    创建并初始化一个众筹活动，参数一经写入不可修改。
                    
                    校验规则（不满足时返回 400 CAMPAIGN_CONFIG）：
                    - 手续费基点不超过 app.campaign.max-fee-bips（默认 1250，即 12.5%）；
                    - 未指定 feeCollector 时两项手续费必须为 0；指定时至少一项大于 0；
                    - goalMin <= goalMax，contributionMin <= contributionMax；
                    - contributionMin 必须小于 goalMax - goalMin（contributionMin = 1 时除外）；
                    - startsAt < endsAt，且窗口长度不超过 app.campaign.max-window（默认 90 天）。
                    
                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/campaigns" \\
                      -H "Content-Type: application/json" \\
                      -d '{
                        "recipient": "alice",
                        "feeCollector": "treasury",
                        "upfrontFeeBips": 250,
                        "payoutFeeBips": 100,
                        "goalMin": "5000000000000000000",
                        "goalMax": "10000000000000000000",
                        "contributionMin": "1000000000000000",
                        "contributionMax": "2000000000000000000",
                        "startsAt": "2026-11-01T00:00:00Z",
                        "endsAt": "2026-12-01T00:00:00Z",
                        "denominationKind": "NATIVE"
                      }'
                    """
    )
    public ApiResponse<CampaignVo> create(
            @Parameter(description = "活动参数", required = true)
            @Valid @RequestBody CampaignCreateDto dto) {
        return ApiResponse.ok(campaignService.create(dto));
    }

    @GetMapping("/{campaignId}")
    @Operation(summary = "查询活动", description = "返回活动参数、状态、累计出资/收益以及当前可执行的操作。")
    public ApiResponse<CampaignVo> get(@PathVariable Long campaignId) {
        return ApiResponse.ok(campaignService.get(campaignId));
    }

    @GetMapping("/{campaignId}/accounts/{account}")
    @Operation(summary = "查询账户持仓", description = "返回账户的份额余额、已提取收益与当前可提取收益。")
    public ApiResponse<AccountVo> account(@PathVariable Long campaignId, @PathVariable String account) {
        return ApiResponse.ok(campaignService.account(campaignId, account));
    }

    @GetMapping("/{campaignId}/accounts/{account}/range")
    @Operation(
            summary = "查询可出资区间",
            description = """
                    返回该账户下一笔出资的合法区间 [min, max]。
                    - 不在出资窗口内、活动已结算/失败或已达募集上限时返回 (0, 0)；
                    - 剩余额度小于 contributionMin 时免除单账户下限（min = 1）；
                    - 达不到下限却会超过上限时区间关闭，同样返回 (0, 0)。
                    """
    )
    public ApiResponse<ContributionRangeVo> range(@PathVariable Long campaignId, @PathVariable String account) {
        return ApiResponse.ok(campaignService.range(campaignId, account));
    }

    @PostMapping("/{campaignId}/contribute")
    @Operation(
            summary = "出资",
            description = """
                    从 account 划入 amount，按实际到账净额 1:1 发放份额。
                    收费代币到账少于请求数量时以到账为准；若按到账额计算后违反单账户上下限，则原路退回并返回 422。
                    
                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/campaigns/1/contribute" \\
                      -H "Content-Type: application/json" \\
                      -d '{"account": "bob", "amount": "1000000000000000000"}'
                    
                    示例响应 (JSON):
                    {
                      "code": 0,
                      "message": "ok",
                      "data": {
                        "campaignId": 1,
                        "account": "bob",
                        "amount": "1000000000000000000",
                        "state": "FUNDING"
                      },
                      "traceId": "b3f7e6c9a1d24c31"
                    }
                    """
    )
    public ApiResponse<OperationResultVo> contribute(@PathVariable Long campaignId,
                                                     @Valid @RequestBody AmountDto dto) {
        return ApiResponse.ok(campaignService.contribute(campaignId, dto));
    }

    @PostMapping("/{campaignId}/settle")
    @Operation(
            summary = "结算",
            description = """
                    达到募集上限（任意时间）或窗口结束且达到最低目标后可调用，任何人均可触发。
                    资金池扣除结算手续费后转给收款方，手续费转给 feeCollector；份额保留，用于后续收益分配。
                    """
    )
    public ApiResponse<CampaignVo> settle(@PathVariable Long campaignId) {
        return ApiResponse.ok(campaignService.settle(campaignId));
    }

    @PostMapping("/{campaignId}/release")
    @Operation(
            summary = "判定失败",
            description = """
                    窗口结束仍未达到最低目标，或窗口结束后超过 app.campaign.stale-grace-period（默认 90 天）仍未结算时可调用。
                    资金留在托管中，由各出资人通过提取接口自行退款。
                    """
    )
    public ApiResponse<CampaignVo> release(@PathVariable Long campaignId) {
        return ApiResponse.ok(campaignService.releaseFailed(campaignId));
    }

    @PostMapping("/{campaignId}/yield")
    @Operation(summary = "注入收益", description = "结算后任何账户都可注入收益，按份额比例分配给持有人。")
    public ApiResponse<OperationResultVo> depositYield(@PathVariable Long campaignId,
                                                       @Valid @RequestBody AmountDto dto) {
        return ApiResponse.ok(campaignService.depositYield(campaignId, dto));
    }

    @PostMapping("/{campaignId}/withdraw")
    @Operation(
            summary = "提取",
            description = """
                    - FAILED：退回账户全部出资，份额清零；
                    - FUNDED：提取当前可提取收益，按 payoutFeeBips 扣除手续费后到账；
                    - FUNDING：返回 409。
                    无可提取余额时返回 422 CAMPAIGN_BALANCE。
                    """
    )
    public ApiResponse<OperationResultVo> withdraw(@PathVariable Long campaignId,
                                                   @Valid @RequestBody AccountDto dto) {
        return ApiResponse.ok(campaignService.withdraw(campaignId, dto));
    }

    @PostMapping("/{campaignId}/transfer")
    @Operation(summary = "转移份额", description = "转移份额时按比例同步转移已提取收益记录，双方待提取收益保持不变。")
    public ApiResponse<AccountVo> transfer(@PathVariable Long campaignId,
                                           @Valid @RequestBody TransferDto dto) {
        return ApiResponse.ok(campaignService.transfer(campaignId, dto));
    }

    @PostMapping("/{campaignId}/approve")
    @Operation(summary = "授权份额", description = "设置 spender 可代 owner 转移的份额额度（覆盖原额度）。")
    public ApiResponse<AllowanceVo> approve(@PathVariable Long campaignId,
                                            @Valid @RequestBody ApproveDto dto) {
        return ApiResponse.ok(campaignService.approve(campaignId, dto));
    }

    @PostMapping("/{campaignId}/transfer-from")
    @Operation(summary = "代理转移份额", description = "spender 在授权额度内代 from 转移份额，额度相应扣减。")
    public ApiResponse<AccountVo> transferFrom(@PathVariable Long campaignId,
                                               @Valid @RequestBody TransferFromDto dto) {
        return ApiResponse.ok(campaignService.transferFrom(campaignId, dto));
    }

    @GetMapping("/{campaignId}/ledger")
    @Operation(summary = "活动流水", description = "分页查询活动的审计流水，按事件序号升序。")
    public ApiResponse<PageVo<CampaignLedgerVo>> ledger(
            @PathVariable Long campaignId,
            @Parameter(description = "页码，从 1 开始", example = "1")
            @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "20")
            @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(campaignService.ledger(campaignId, Math.max(page, 1), Math.min(Math.max(size, 1), 200)));
    }
}
