package com.optionsbacktest.backtest.engine;

import java.util.Locale;

/**
 * Fixed-fraction position sizing.
 * <p>
 * {@code contracts = floor(cash * fraction / (fill * 100))}, capped at the per-trade maximum.
 * A non-positive fill, a zero count or a total cost above available cash yields no trade.
 */
public class PositionSizer {

    /**
     * Sizing decision. {@code contracts} is 0 when no trade should be placed.
     */
    public record SizingResult(int contracts, double totalCost, String rationale) {
        public boolean isTradable() {
            return contracts > 0;
        }
    }

    private final double positionSizeFraction;
    private final double commissionPerContract;
    private final int maxContractsPerTrade;

    public PositionSizer(double positionSizeFraction, double commissionPerContract, int maxContractsPerTrade) {
        this.positionSizeFraction = positionSizeFraction;
        this.commissionPerContract = commissionPerContract;
        this.maxContractsPerTrade = maxContractsPerTrade;
    }

    public SizingResult size(double cash, double fillPrice) {
        if (!(fillPrice > 0)) {
            return new SizingResult(0, 0.0, "insufficient capital: fill price " + fillPrice + " is not positive");
        }
        double allocation = cash * positionSizeFraction;
        long raw = (long) Math.floor(allocation / (fillPrice * 100.0));
        int contracts = (int) Math.max(0, Math.min(raw, maxContractsPerTrade));
        if (contracts == 0) {
            return new SizingResult(0, 0.0, String.format(Locale.ROOT,
                    "insufficient capital: allocation %.2f buys no contract at %.4f", allocation, fillPrice));
        }
        double cost = fillPrice * contracts * 100.0 + commissionPerContract * contracts;
        if (cost > cash) {
            return new SizingResult(0, 0.0, String.format(Locale.ROOT,
                    "insufficient capital: cost %.2f exceeds cash %.2f", cost, cash));
        }
        String capped = raw > maxContractsPerTrade ? " (capped at " + maxContractsPerTrade + ")" : "";
        return new SizingResult(contracts, cost, String.format(Locale.ROOT,
                "%d contract(s) from allocation %.2f at %.4f%s", contracts, allocation, fillPrice, capped));
    }
}
