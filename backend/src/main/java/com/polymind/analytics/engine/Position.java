package com.polymind.analytics.engine;

import com.polymind.domain.TradeSide;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Average-cost position in one outcome token. {@code netSize} is positive when long and negative when short;
 * selling more than is held flips the remainder to a short opened at the fill price.
 */
final class Position {

    private static final int SCALE = 6;

    private BigDecimal netSize = BigDecimal.ZERO;
    private BigDecimal averageCost = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    void apply(TradeSide side, BigDecimal size, BigDecimal price) {
        if (size == null || price == null || size.signum() <= 0) {
            return;
        }
        BigDecimal signed = side == TradeSide.BUY ? size : size.negate();
        if (netSize.signum() == 0 || netSize.signum() == signed.signum()) {
            BigDecimal next = netSize.add(signed);
            averageCost = netSize.abs().multiply(averageCost).add(size.multiply(price))
                    .divide(next.abs(), SCALE, RoundingMode.HALF_UP);
            netSize = next;
            return;
        }
        BigDecimal closed = size.min(netSize.abs());
        BigDecimal perUnit = netSize.signum() > 0 ? price.subtract(averageCost) : averageCost.subtract(price);
        realizedPnl = realizedPnl.add(perUnit.multiply(closed));
        netSize = netSize.add(signed);
        if (netSize.signum() == 0) {
            averageCost = BigDecimal.ZERO;
        } else if (netSize.signum() == signed.signum()) {
            averageCost = price;
        }
    }

    /** Redeems the open size at {@code payout} (1 for the winning outcome, 0 otherwise) and closes the position. */
    void settle(BigDecimal payout) {
        if (netSize.signum() == 0) {
            return;
        }
        realizedPnl = realizedPnl.add(payout.subtract(averageCost).multiply(netSize));
        netSize = BigDecimal.ZERO;
        averageCost = BigDecimal.ZERO;
    }

    /** Zero when flat or never priced. */
    BigDecimal unrealizedPnl(BigDecimal markPrice) {
        if (netSize.signum() == 0 || markPrice == null) {
            return BigDecimal.ZERO;
        }
        return markPrice.subtract(averageCost).multiply(netSize);
    }

    boolean isOpen() {
        return netSize.signum() != 0;
    }

    BigDecimal netSize() {
        return netSize;
    }

    BigDecimal averageCost() {
        return averageCost;
    }

    BigDecimal realizedPnl() {
        return realizedPnl;
    }
}
