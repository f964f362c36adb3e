package com.slb.crowdfund_backend.modules.campaign.transport;

import java.math.BigInteger;

public record TransferLeg(String to, BigInteger amount) {
}
