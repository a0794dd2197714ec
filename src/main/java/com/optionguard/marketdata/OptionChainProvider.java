package com.optionguard.marketdata;

/**
 * Market-data collaborator that resolves a chain for a symbol near a target
 * days-to-expiration.
 */
public interface OptionChainProvider {

    /**
     * @throws com.optionguard.exception.NoDataException if the symbol has no chain or no
     *     expiration near the target
     */
    OptionChain getChain(String symbol, int targetDte, double underlyingPrice);
}
