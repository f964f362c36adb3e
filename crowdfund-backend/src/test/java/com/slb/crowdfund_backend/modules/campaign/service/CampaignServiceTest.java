package com.slb.crowdfund_backend.modules.campaign.service;

import com.slb.crowdfund_backend.common.vo.PageVo;
import com.slb.crowdfund_backend.modules.campaign.config.CampaignProperties;
import com.slb.crowdfund_backend.modules.campaign.config.TransportProperties;
import com.slb.crowdfund_backend.modules.campaign.dto.AccountDto;
import com.slb.crowdfund_backend.modules.campaign.dto.AmountDto;
import com.slb.crowdfund_backend.modules.campaign.dto.CampaignCreateDto;
import com.slb.crowdfund_backend.modules.campaign.dto.TransferDto;
import com.slb.crowdfund_backend.modules.campaign.entity.CampaignLedgerEntry;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignErrorType;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import com.slb.crowdfund_backend.modules.campaign.mapper.CampaignLedgerMapper;
import com.slb.crowdfund_backend.modules.campaign.support.MutableClock;
import com.slb.crowdfund_backend.modules.campaign.transport.InMemoryCustodyBook;
import com.slb.crowdfund_backend.modules.campaign.transport.InMemoryTransportFactory;
import com.slb.crowdfund_backend.modules.campaign.vo.AccountVo;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignLedgerVo;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignVo;
import com.slb.crowdfund_backend.modules.campaign.vo.ContributionRangeVo;
import com.slb.crowdfund_backend.modules.campaign.vo.OperationResultVo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.COLLECTOR;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.END;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.RECIPIENT;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.START;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e16;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e17;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e18;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CampaignServiceTest {

    @Mock
    private CampaignLedgerMapper ledgerMapper;

    @Captor
    private ArgumentCaptor<CampaignLedgerEntry> entryCaptor;

    private MutableClock clock;
    private InMemoryCustodyBook custodyBook;
    private CampaignService campaignService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START.minusSeconds(3600));
        custodyBook = new InMemoryCustodyBook();
        InMemoryTransportFactory transportFactory = new InMemoryTransportFactory(custodyBook, new TransportProperties());
        CampaignAuditService auditService = new CampaignAuditService(ledgerMapper, clock);
        campaignService = new CampaignService(clock, transportFactory, auditService, new CampaignProperties());
        lenient().when(ledgerMapper.insertIgnore(any())).thenReturn(1);
    }

    private CampaignCreateDto createDto() {
        CampaignCreateDto dto = new CampaignCreateDto();
        dto.setRecipient(RECIPIENT);
        dto.setGoalMin(e18(2));
        dto.setGoalMax(e18(5));
        dto.setContributionMin(e17(2));
        dto.setContributionMax(e18(1));
        dto.setStartsAt(START);
        dto.setEndsAt(END);
        return dto;
    }

    private AmountDto amount(String account, BigInteger amount) {
        AmountDto dto = new AmountDto();
        dto.setAccount(account);
        dto.setAmount(amount);
        return dto;
    }

    private OperationResultVo fundAndContribute(Long campaignId, String account, BigInteger value) {
        custodyBook.mint("NATIVE", account, value);
        return campaignService.contribute(campaignId, amount(account, value));
    }

    @Test
    void createShouldInitializeCampaignAndRecordFeeSchedule() {
        CampaignCreateDto dto = createDto();
        dto.setFeeCollector(COLLECTOR);
        dto.setUpfrontFeeBips(100);

        CampaignVo vo = campaignService.create(dto);

        assertThat(vo.getCampaignId()).isEqualTo(1L);
        assertThat(vo.getState()).isEqualTo("FUNDING");
        assertThat(vo.getDenomination()).isEqualTo("NATIVE");
        assertThat(vo.getDepositTotal()).isEqualTo("0");
        assertThat(vo.isContributionAllowed()).isFalse();
        verify(ledgerMapper).insertIgnore(entryCaptor.capture());
        CampaignLedgerEntry entry = entryCaptor.getValue();
        assertThat(entry.getEventType()).isEqualTo("FEE_SCHEDULE_APPLIED");
        assertThat(entry.getAccount()).isEqualTo(COLLECTOR);
        assertThat(entry.getSeq()).isEqualTo(1L);
    }

    @Test
    void createShouldRejectInvalidConfigWithoutRegistering() {
        CampaignCreateDto dto = createDto();
        dto.setPayoutFeeBips(100);

        CampaignException ex = assertThrows(CampaignException.class, () -> campaignService.create(dto));

        assertThat(ex.getType()).isEqualTo(CampaignErrorType.CONFIG);
        assertThat(campaignService.list()).isEmpty();
        verify(ledgerMapper, never()).insertIgnore(any());
    }

    @Test
    void createShouldRejectUnknownDenomination() {
        CampaignCreateDto dto = createDto();
        dto.setDenominationKind("ERC721");

        CampaignException ex = assertThrows(CampaignException.class, () -> campaignService.create(dto));
        assertThat(ex.getType()).isEqualTo(CampaignErrorType.CONFIG);

        dto.setDenominationKind("EXTERNAL");
        CampaignException missingRef = assertThrows(CampaignException.class, () -> campaignService.create(dto));
        assertThat(missingRef.getType()).isEqualTo(CampaignErrorType.CONFIG);
    }

    @Test
    void unknownCampaignShouldBeNotFound() {
        CampaignException ex = assertThrows(CampaignException.class, () -> campaignService.get(42L));

        assertThat(ex.getType()).isEqualTo(CampaignErrorType.NOT_FOUND);
        assertThat(ex.getCode()).isEqualTo(404);
    }

    @Test
    void fullLifecycleShouldSettlePayYieldAndAudit() {
        Long id = campaignService.create(createDto()).getCampaignId();
        clock.set(START);

        ContributionRangeVo range = campaignService.range(id, "bob");
        assertThat(range.isOpen()).isTrue();
        assertThat(range.getMin()).isEqualTo(e17(2).toString());

        fundAndContribute(id, "bob", e18(1));
        fundAndContribute(id, "carol", e18(1));
        OperationResultVo third = fundAndContribute(id, "dave", e18(1));
        assertThat(third.getAmount()).isEqualTo(e18(1).toString());

        clock.set(END);
        CampaignVo settled = campaignService.settle(id);
        assertThat(settled.getState()).isEqualTo("FUNDED");
        assertThat(custodyBook.balanceOf("NATIVE", RECIPIENT)).isEqualTo(e18(3));

        custodyBook.mint("NATIVE", "pool", e18(3));
        campaignService.depositYield(id, amount("pool", e18(3)));

        TransferDto transfer = new TransferDto();
        transfer.setFrom("bob");
        transfer.setTo("erin");
        transfer.setAmount(e17(5));
        AccountVo bob = campaignService.transfer(id, transfer);
        assertThat(bob.getShareBalance()).isEqualTo(e17(5).toString());
        assertThat(bob.getYieldBalance()).isEqualTo(e17(5).toString());

        AccountDto withdraw = new AccountDto();
        withdraw.setAccount("erin");
        OperationResultVo paid = campaignService.withdraw(id, withdraw);
        assertThat(paid.getAmount()).isEqualTo(e17(5).toString());
        assertThat(campaignService.account(id, "erin").getYieldBalance()).isEqualTo("0");
        assertThat(campaignService.account(id, "erin").isHasClaim()).isTrue();

        verify(ledgerMapper, atLeastOnce()).insertIgnore(entryCaptor.capture());
        List<String> types = entryCaptor.getAllValues().stream().map(CampaignLedgerEntry::getEventType).toList();
        assertThat(types).containsExactly(
                "CONTRIBUTION_ACCEPTED", "CONTRIBUTION_ACCEPTED", "CONTRIBUTION_ACCEPTED",
                "SETTLED", "YIELD_DEPOSITED", "SHARE_TRANSFER", "WITHDRAWN");
        assertThat(entryCaptor.getAllValues().get(6).getAmount()).isEqualTo(e17(5).toString());
    }

    @Test
    void rangeShouldBeClosedOutsideTheWindow() {
        Long id = campaignService.create(createDto()).getCampaignId();

        ContributionRangeVo range = campaignService.range(id, "bob");

        assertThat(range.isOpen()).isFalse();
        assertThat(range.getMin()).isEqualTo("0");
        assertThat(range.getMax()).isEqualTo("0");
    }

    @Test
    void releaseDueCampaignsShouldOnlyFailEligibleCampaigns() {
        Long underfunded = campaignService.create(createDto()).getCampaignId();
        Long funded = campaignService.create(createDto()).getCampaignId();
        clock.set(START);
        fundAndContribute(underfunded, "bob", e17(3));
        fundAndContribute(funded, "bob", e18(1));
        fundAndContribute(funded, "carol", e18(1));
        clock.set(END);

        int released = campaignService.releaseDueCampaigns();

        assertThat(released).isEqualTo(1);
        assertThat(campaignService.get(underfunded).getState()).isEqualTo("FAILED");
        assertThat(campaignService.get(funded).getState()).isEqualTo("FUNDING");
        assertThat(campaignService.get(funded).isCanSettle()).isTrue();
        assertThat(campaignService.releaseDueCampaigns()).isZero();
    }

    @Test
    void payoutFeeShouldReachCollectorThroughService() {
        CampaignCreateDto dto = createDto();
        dto.setFeeCollector(COLLECTOR);
        dto.setPayoutFeeBips(100);
        Long id = campaignService.create(dto).getCampaignId();
        clock.set(START);
        fundAndContribute(id, "bob", e18(1));
        fundAndContribute(id, "carol", e18(1));
        clock.set(END);
        campaignService.settle(id);
        custodyBook.mint("NATIVE", "pool", e18(2));
        campaignService.depositYield(id, amount("pool", e18(2)));

        AccountDto withdraw = new AccountDto();
        withdraw.setAccount("bob");
        OperationResultVo paid = campaignService.withdraw(id, withdraw);

        assertThat(paid.getAmount()).isEqualTo(e16(99).toString());
        assertThat(campaignService.get(id).getCollectorFeesAccrued()).isEqualTo(e16(1).toString());
    }

    @Test
    void ledgerShouldReturnEmptyPageWithoutRows() {
        Long id = campaignService.create(createDto()).getCampaignId();
        when(ledgerMapper.countByCampaignId(id)).thenReturn(0L);

        PageVo<CampaignLedgerVo> page = campaignService.ledger(id, 1, 20);

        assertThat(page.getTotal()).isZero();
        assertThat(page.getList()).isEmpty();
    }

    @Test
    void idsShouldContinueAfterCampaignsAlreadyInLedger() {
        when(ledgerMapper.selectMaxCampaignId()).thenReturn(7L);
        campaignService.init();

        CampaignVo vo = campaignService.create(createDto());

        assertThat(vo.getCampaignId()).isEqualTo(8L);
        assertThat(campaignService.get(8L).getState()).isEqualTo("FUNDING");
        CampaignException ex = assertThrows(CampaignException.class, () -> campaignService.get(7L));
        assertThat(ex.getType()).isEqualTo(CampaignErrorType.NOT_FOUND);
    }
}
