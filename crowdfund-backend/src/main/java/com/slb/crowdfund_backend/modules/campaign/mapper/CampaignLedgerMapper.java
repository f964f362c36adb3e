package com.slb.crowdfund_backend.modules.campaign.mapper;

import com.slb.crowdfund_backend.modules.campaign.entity.CampaignLedgerEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper：用于 campaign_ledger 表的持久化操作。
 */
@Mapper
public interface CampaignLedgerMapper {

    /**
     * 幂等插入：若命中 (campaign_id, seq) 唯一键冲突则忽略（返回 0）。
     */
    int insertIgnore(CampaignLedgerEntry entry);

    /**
     * 已写入流水的最大活动 ID，无记录时返回 null。
     */
    Long selectMaxCampaignId();

    long countByCampaignId(@Param("campaignId") Long campaignId);

    List<CampaignLedgerEntry> findByCampaignIdPaginated(@Param("campaignId") Long campaignId,
                                                        @Param("offset") int offset,
                                                        @Param("size") int size);
}
