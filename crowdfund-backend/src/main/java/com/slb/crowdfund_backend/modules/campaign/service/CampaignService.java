package com.slb.crowdfund_backend.modules.campaign.service;

import com.slb.crowdfund_backend.common.vo.PageVo;
import com.slb.crowdfund_backend.modules.campaign.config.CampaignProperties;
import com.slb.crowdfund_backend.modules.campaign.domain.AccountPosition;
import com.slb.crowdfund_backend.modules.campaign.domain.Campaign;
import com.slb.crowdfund_backend.modules.campaign.domain.CampaignConfig;
import com.slb.crowdfund_backend.modules.campaign.domain.ContributionRange;
import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;
import com.slb.crowdfund_backend.modules.campaign.dto.AccountDto;
import com.slb.crowdfund_backend.modules.campaign.dto.AmountDto;
import com.slb.crowdfund_backend.modules.campaign.dto.ApproveDto;
import com.slb.crowdfund_backend.modules.campaign.dto.CampaignCreateDto;
import com.slb.crowdfund_backend.modules.campaign.dto.TransferDto;
import com.slb.crowdfund_backend.modules.campaign.dto.TransferFromDto;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import com.slb.crowdfund_backend.modules.campaign.transport.TransportFactory;
import com.slb.crowdfund_backend.modules.campaign.vo.AccountVo;
import com.slb.crowdfund_backend.modules.campaign.vo.AllowanceVo;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignLedgerVo;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignVo;
import com.slb.crowdfund_backend.modules.campaign.vo.ContributionRangeVo;
import com.slb.crowdfund_backend.modules.campaign.vo.OperationResultVo;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 众筹活动服务：维护进程内的活动注册表，并把接口请求转交给对应的 {@link Campaign}。
 */
@Service
@Slf4j
public class CampaignService {

    private final Clock clock;
    private final TransportFactory transportFactory;
    private final CampaignAuditService auditService;
    private final CampaignProperties campaignProperties;

    private final Map<Long, Campaign> campaigns = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    public CampaignService(Clock clock,
                           TransportFactory transportFactory,
                           CampaignAuditService auditService,
                           CampaignProperties campaignProperties) {
        this.clock = clock;
        this.transportFactory = transportFactory;
        this.auditService = auditService;
        this.campaignProperties = campaignProperties;
    }

    @PostConstruct
    public void init() {
        long last = auditService.lastRecordedCampaignId();
        idSequence.set(last);
        log.info("Campaign id sequence seeded from ledger: lastCampaignId={}", last);
    }

    public CampaignVo create(CampaignCreateDto dto) {
        CampaignConfig config = toConfig(dto);
        long id = idSequence.incrementAndGet();
        Campaign campaign = new Campaign(id, clock, campaignProperties.toPolicy(), transportFactory, auditService);
        campaign.initialize(config);
        campaigns.put(id, campaign);
        return toVo(campaign);
    }

    public CampaignVo get(Long campaignId) {
        return toVo(find(campaignId));
    }

    public AccountVo account(Long campaignId, String account) {
        Campaign campaign = find(campaignId);
        return toVo(campaignId, campaign.positionOf(account), campaign.hasClaim(account));
    }

    public ContributionRangeVo range(Long campaignId, String account) {
        ContributionRange range = find(campaignId).contributionRangeFor(account);
        ContributionRangeVo vo = new ContributionRangeVo();
        vo.setCampaignId(campaignId);
        vo.setAccount(account);
        vo.setMin(range.min().toString());
        vo.setMax(range.max().toString());
        vo.setOpen(range.isOpen());
        return vo;
    }

    public OperationResultVo contribute(Long campaignId, AmountDto dto) {
        Campaign campaign = find(campaignId);
        BigInteger received = campaign.contribute(dto.getAccount(), dto.getAmount());
        return new OperationResultVo(campaignId, dto.getAccount(), received.toString(), campaign.getState().name());
    }

    public CampaignVo settle(Long campaignId) {
        Campaign campaign = find(campaignId);
        campaign.settle();
        return toVo(campaign);
    }

    public CampaignVo releaseFailed(Long campaignId) {
        Campaign campaign = find(campaignId);
        campaign.releaseFailed();
        return toVo(campaign);
    }

    public OperationResultVo depositYield(Long campaignId, AmountDto dto) {
        Campaign campaign = find(campaignId);
        BigInteger received = campaign.depositYield(dto.getAccount(), dto.getAmount());
        return new OperationResultVo(campaignId, dto.getAccount(), received.toString(), campaign.getState().name());
    }

    public OperationResultVo withdraw(Long campaignId, AccountDto dto) {
        Campaign campaign = find(campaignId);
        BigInteger paid = campaign.withdraw(dto.getAccount());
        return new OperationResultVo(campaignId, dto.getAccount(), paid.toString(), campaign.getState().name());
    }

    public AccountVo transfer(Long campaignId, TransferDto dto) {
        Campaign campaign = find(campaignId);
        campaign.transfer(dto.getFrom(), dto.getTo(), dto.getAmount());
        return toVo(campaignId, campaign.positionOf(dto.getFrom()), campaign.hasClaim(dto.getFrom()));
    }

    public AllowanceVo approve(Long campaignId, ApproveDto dto) {
        Campaign campaign = find(campaignId);
        campaign.approve(dto.getOwner(), dto.getSpender(), dto.getAmount());
        return new AllowanceVo(campaignId, dto.getOwner(), dto.getSpender(),
                campaign.allowance(dto.getOwner(), dto.getSpender()).toString());
    }

    public AccountVo transferFrom(Long campaignId, TransferFromDto dto) {
        Campaign campaign = find(campaignId);
        campaign.transferFrom(dto.getSpender(), dto.getFrom(), dto.getTo(), dto.getAmount());
        return toVo(campaignId, campaign.positionOf(dto.getFrom()), campaign.hasClaim(dto.getFrom()));
    }

    public PageVo<CampaignLedgerVo> ledger(Long campaignId, int page, int size) {
        find(campaignId);
        return auditService.page(campaignId, page, size);
    }

    /**
     * 把所有已满足失败条件的活动置为 FAILED；单个活动失败不影响其他活动。
     *
     * @return 本次置为失败的活动数量
     */
    public int releaseDueCampaigns() {
        int released = 0;
        for (Campaign campaign : new ArrayList<>(campaigns.values())) {
            if (!campaign.canReleaseFailed()) {
                continue;
            }
            try {
                campaign.releaseFailed();
                released++;
            } catch (CampaignException ex) {
                log.warn("Scheduled release skipped: campaignId={}, type={}, message={}",
                        campaign.getId(), ex.getType(), ex.getMessage());
            }
        }
        return released;
    }

    public List<Campaign> list() {
        return List.copyOf(campaigns.values());
    }

    Campaign find(Long campaignId) {
        Campaign campaign = campaignId == null ? null : campaigns.get(campaignId);
        if (campaign == null) {
            throw CampaignException.notFound(campaignId);
        }
        return campaign;
    }

    private CampaignConfig toConfig(CampaignCreateDto dto) {
        Denomination denomination;
        try {
            denomination = Denomination.of(dto.getDenominationKind(), dto.getTokenRef());
        } catch (IllegalArgumentException ex) {
            throw CampaignException.config(ex.getMessage());
        }
        String collector = StringUtils.hasText(dto.getFeeCollector()) ? dto.getFeeCollector().trim() : null;
        return new CampaignConfig(
                dto.getRecipient(),
                collector,
                dto.getUpfrontFeeBips(),
                dto.getPayoutFeeBips(),
                dto.getGoalMin(),
                dto.getGoalMax(),
                dto.getContributionMin(),
                dto.getContributionMax(),
                dto.getStartsAt(),
                dto.getEndsAt(),
                denomination);
    }

    private CampaignVo toVo(Campaign campaign) {
        CampaignConfig config = campaign.getConfig();
        CampaignVo vo = new CampaignVo();
        vo.setCampaignId(campaign.getId());
        vo.setState(campaign.getState().name());
        vo.setProcessed(campaign.isProcessed());
        vo.setDenomination(config.denomination().key());
        vo.setRecipient(config.recipient());
        vo.setFeeCollector(config.feeCollector());
        vo.setUpfrontFeeBips(config.upfrontFeeBips());
        vo.setPayoutFeeBips(config.payoutFeeBips());
        vo.setGoalMin(config.goalMin().toString());
        vo.setGoalMax(config.goalMax().toString());
        vo.setContributionMin(config.contributionMin().toString());
        vo.setContributionMax(config.contributionMax().toString());
        vo.setStartsAt(config.startsAt());
        vo.setEndsAt(config.endsAt());
        vo.setDepositTotal(campaign.depositTotal().toString());
        vo.setYieldTotal(campaign.yieldTotal().toString());
        vo.setCollectorFeesAccrued(campaign.collectorFeesAccrued().toString());
        vo.setHeldBalance(campaign.heldBalance().toString());
        vo.setContributionAllowed(campaign.isContributionAllowed());
        vo.setGoalMinMet(campaign.isGoalMinMet());
        vo.setGoalMaxMet(campaign.isGoalMaxMet());
        vo.setCanSettle(campaign.canSettle());
        vo.setCanReleaseFailed(campaign.canReleaseFailed());
        return vo;
    }

    private AccountVo toVo(Long campaignId, AccountPosition position, boolean hasClaim) {
        AccountVo vo = new AccountVo();
        vo.setCampaignId(campaignId);
        vo.setAccount(position.account());
        vo.setShareBalance(position.shareBalance().toString());
        vo.setWithdrawn(position.withdrawn().toString());
        vo.setYieldBalance(position.yieldBalance().toString());
        vo.setHasClaim(hasClaim);
        return vo;
    }
}
