package com.optionguard.marketdata;

import com.optionguard.domain.model.MarketContext;

public interface MarketContextProvider {

    MarketContext getContext(String symbol);
}
