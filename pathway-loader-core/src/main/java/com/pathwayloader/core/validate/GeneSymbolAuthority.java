package com.pathwayloader.core.validate;

import java.util.Collection;
import java.util.Set;

/**
 * Lookup of valid gene symbols published by a naming authority such as HGNC.
 *
 * <p>Lookups are case-sensitive exact matches.
 */
public interface GeneSymbolAuthority {

    /**
     * Returns true if the symbol is an approved gene symbol.
     *
     * @param symbol display name of a gene node
     * @return true if known to the authority
     */
    boolean isValid(String symbol);

    /**
     * Returns the number of symbols known to the authority.
     *
     * @return symbol count
     */
    int size();

    /**
     * Creates an authority backed by a fixed symbol set.
     *
     * @param symbols approved symbols
     * @return authority
     */
    static GeneSymbolAuthority of(Collection<String> symbols) {
        Set<String> copy = Set.copyOf(symbols);
        return new GeneSymbolAuthority() {
            @Override
            public boolean isValid(String symbol) {
                return symbol != null && copy.contains(symbol);
            }

            @Override
            public int size() {
                return copy.size();
            }
        };
    }

    /**
     * Creates an authority that accepts every symbol, used when no symbol list is configured.
     *
     * @return permissive authority
     */
    static GeneSymbolAuthority acceptAll() {
        return new GeneSymbolAuthority() {
            @Override
            public boolean isValid(String symbol) {
                return true;
            }

            @Override
            public int size() {
                return 0;
            }
        };
    }
}
