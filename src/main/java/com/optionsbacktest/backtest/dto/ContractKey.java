package com.optionsbacktest.backtest.dto;

import java.time.LocalDate;

/**
 * Exact identity of a listed option contract.
 * <p>
 * Positions are marked by looking this key up in each day's snapshot, so strike
 * comparison must be exact: loaders are expected to normalize strikes to currency units.
 */
public record ContractKey(double strike, LocalDate expiration, OptionRight right) {

    @Override
    public String toString() {
        return right.getCode() + " " + strike + " " + expiration;
    }
}
