package com.optionsbacktest.backtest.dto;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The option chain and underlying price for a single trading date.
 * <p>
 * Rows keep their source order. Lookup by {@link ContractKey} is exact; when a source
 * carries duplicate rows for one contract the first row wins.
 */
public final class MarketSnapshot {

    private final LocalDate date;
    private final double underlyingPrice;
    private final List<OptionQuote> quotes;
    private final Map<ContractKey, OptionQuote> index;

    public MarketSnapshot(LocalDate date, double underlyingPrice, List<OptionQuote> quotes) {
        this.date = date;
        this.underlyingPrice = underlyingPrice;
        this.quotes = List.copyOf(quotes);
        Map<ContractKey, OptionQuote> byKey = new LinkedHashMap<>();
        for (OptionQuote quote : this.quotes) {
            byKey.putIfAbsent(quote.key(), quote);
        }
        this.index = Collections.unmodifiableMap(byKey);
    }

    public LocalDate getDate() {
        return date;
    }

    public double getUnderlyingPrice() {
        return underlyingPrice;
    }

    public List<OptionQuote> getQuotes() {
        return quotes;
    }

    public Optional<OptionQuote> find(ContractKey key) {
        return Optional.ofNullable(index.get(key));
    }

    public int size() {
        return quotes.size();
    }
}
