package com.slb.crowdfund_backend.modules.campaign.domain;

import java.math.BigInteger;

/**
 * Point-in-time view of one account's shares and yield accounting.
 */
public record AccountPosition(String account,
                              BigInteger shareBalance,
                              BigInteger withdrawn,
                              BigInteger yieldBalance) {
}
