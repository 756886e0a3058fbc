package com.demo.lending.service.valuation;

import com.demo.lending.domain.Quote;

/** External price source. Any failure, including a revert on the feed, is reported by throwing. */
public interface PriceOracle {

    Quote latestQuote(String priceFeedRef);
}
