package com.slb.crowdfund_backend.modules.campaign.domain;

/**
 * FUNDING is the only non-terminal state.
 */
public enum CampaignState {
    FUNDING,
    FAILED,
    FUNDED;

    public boolean isTerminal() {
        return this != FUNDING;
    }
}
