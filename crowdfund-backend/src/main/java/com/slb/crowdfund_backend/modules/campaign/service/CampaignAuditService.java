package com.slb.crowdfund_backend.modules.campaign.service;

import com.slb.crowdfund_backend.common.trace.TraceIdHolder;
import com.slb.crowdfund_backend.common.vo.PageVo;
import com.slb.crowdfund_backend.modules.campaign.entity.CampaignLedgerEntry;
import com.slb.crowdfund_backend.modules.campaign.event.CampaignEvent;
import com.slb.crowdfund_backend.modules.campaign.event.CampaignEventListener;
import com.slb.crowdfund_backend.modules.campaign.mapper.CampaignLedgerMapper;
import com.slb.crowdfund_backend.modules.campaign.vo.CampaignLedgerVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 活动事件审计：把每个已提交的活动事件写入 campaign_ledger。
 * 活动状态本身在内存中维护，这里的流水只用于查询与对账，写入失败不回滚业务操作。
 */
@Service
@Slf4j
public class CampaignAuditService implements CampaignEventListener {

    private final CampaignLedgerMapper ledgerMapper;
    private final Clock clock;
    private final Map<Long, AtomicLong> sequences = new ConcurrentHashMap<>();

    public CampaignAuditService(CampaignLedgerMapper ledgerMapper, Clock clock) {
        this.ledgerMapper = ledgerMapper;
        this.clock = clock;
    }

    @Override
    public void onEvent(CampaignEvent event) {
        CampaignLedgerEntry entry = toEntry(event);
        try {
            int rows = ledgerMapper.insertIgnore(entry);
            if (rows == 0) {
                log.warn("Campaign ledger row already present: campaignId={}, seq={}, eventType={}",
                        entry.getCampaignId(), entry.getSeq(), entry.getEventType());
            }
        } catch (RuntimeException ex) {
            // 流水写入失败只记录告警，链上/托管状态已经提交
            log.warn("Failed to record campaign ledger: campaignId={}, seq={}, eventType={}, account={}, amount={}",
                    entry.getCampaignId(), entry.getSeq(), entry.getEventType(), entry.getAccount(), entry.getAmount(), ex);
        }
    }

    /**
     * 流水表中出现过的最大活动 ID；新活动 ID 必须大于它，否则 (campaign_id, seq) 会与旧流水冲突。
     */
    public long lastRecordedCampaignId() {
        Long max = ledgerMapper.selectMaxCampaignId();
        return max != null ? max : 0L;
    }

    public PageVo<CampaignLedgerVo> page(Long campaignId, int page, int size) {
        long total = ledgerMapper.countByCampaignId(campaignId);
        if (total == 0) {
            return PageVo.empty(page, size);
        }
        int offset = (page - 1) * size;
        List<CampaignLedgerEntry> rows = ledgerMapper.findByCampaignIdPaginated(campaignId, offset, size);
        List<CampaignLedgerVo> voList = rows.stream().map(this::toVo).collect(Collectors.toList());
        return new PageVo<>(total, page, size, voList);
    }

    CampaignLedgerEntry toEntry(CampaignEvent event) {
        CampaignLedgerEntry entry = new CampaignLedgerEntry();
        entry.setCampaignId(event.campaignId());
        entry.setSeq(sequences.computeIfAbsent(event.campaignId(), id -> new AtomicLong()).incrementAndGet());
        entry.setEventType(event.type());
        entry.setAccount(event.account());
        entry.setCounterparty(event.counterparty());
        entry.setAmount(event.amount() != null ? event.amount().toString() : null);
        entry.setTraceId(TraceIdHolder.getOptional().orElse(null));
        entry.setEventTime(LocalDateTime.ofInstant(clock.instant(), clock.getZone()));
        return entry;
    }

    private CampaignLedgerVo toVo(CampaignLedgerEntry entry) {
        CampaignLedgerVo vo = new CampaignLedgerVo();
        BeanUtils.copyProperties(entry, vo);
        return vo;
    }
}
