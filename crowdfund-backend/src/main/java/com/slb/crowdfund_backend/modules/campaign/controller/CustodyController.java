package com.slb.crowdfund_backend.modules.campaign.controller;

import com.slb.crowdfund_backend.common.api.ApiResponse;
import com.slb.crowdfund_backend.common.exception.BizException;
import com.slb.crowdfund_backend.modules.campaign.config.TransportProperties;
import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;
import com.slb.crowdfund_backend.modules.campaign.dto.FaucetDto;
import com.slb.crowdfund_backend.modules.campaign.transport.InMemoryCustodyBook;
import com.slb.crowdfund_backend.modules.campaign.vo.CustodyBalanceVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

/**
 * 开发环境的托管账本入口：充值测试资金与查询余额。
 */
@RestController
@RequestMapping("api/v1/custody")
@Tag(name = "托管账本（开发）", description = "仅用于开发与联调：为账户充值测试资金、查询托管账本余额")
@Slf4j
public class CustodyController {

    private final InMemoryCustodyBook custodyBook;
    private final TransportProperties transportProperties;

    public CustodyController(InMemoryCustodyBook custodyBook, TransportProperties transportProperties) {
        this.custodyBook = custodyBook;
        this.transportProperties = transportProperties;
    }

    @PostMapping("/faucet")
    @Operation(summary = "充值测试资金", description = "app.transport.faucet-enabled=false 时返回 403。")
    public ApiResponse<CustodyBalanceVo> faucet(@Valid @RequestBody FaucetDto dto) {
        if (!transportProperties.isFaucetEnabled()) {
            throw new BizException(403, "FAUCET_DISABLED", "faucet is disabled");
        }
        Denomination denomination = resolve(dto.getDenominationKind(), dto.getTokenRef());
        custodyBook.mint(denomination.key(), dto.getHolder(), dto.getAmount());
        log.info("Faucet mint: denomination={}, holder={}, amount={}", denomination.key(), dto.getHolder(), dto.getAmount());
        return ApiResponse.ok(balanceVo(denomination, dto.getHolder()));
    }

    @GetMapping("/balances/{holder}")
    @Operation(summary = "查询托管余额", description = "denominationKind 缺省为 NATIVE；EXTERNAL 时需传 tokenRef。")
    public ApiResponse<CustodyBalanceVo> balance(@PathVariable String holder,
                                                 @RequestParam(required = false) String denominationKind,
                                                 @RequestParam(required = false) String tokenRef) {
        return ApiResponse.ok(balanceVo(resolve(denominationKind, tokenRef), holder));
    }

    private CustodyBalanceVo balanceVo(Denomination denomination, String holder) {
        return new CustodyBalanceVo(denomination.key(), holder,
                custodyBook.balanceOf(denomination.key(), holder).toString());
    }

    private static Denomination resolve(String kind, String tokenRef) {
        try {
            return Denomination.of(kind, tokenRef);
        } catch (IllegalArgumentException ex) {
            throw new BizException(400, "INVALID_DENOMINATION", ex.getMessage());
        }
    }
}
