package io.magicalne.cex.handler;

import io.magicalne.cex.dto.BlockchainCurrency;
import io.magicalne.cex.dto.NormalizedCurrency;
import io.magicalne.cex.dto.WrappedCurrency;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds wrapped tokens into their underlying currency. A wrapped record ({@code WBTC}) whose
 * underlying currency ({@code BTC}) is in the same batch is removed, and its platforms are added
 * to the underlying currency with a {@link WrappedCurrency} key pointing back at it.
 */
@Slf4j
public final class WrappedCurrencyLinker {

    private WrappedCurrencyLinker() {
    }

    public static List<NormalizedCurrency> link(List<NormalizedCurrency> currencies) {
        Map<String, NormalizedCurrency> unwrappedBySymbol = new LinkedHashMap<>();
        for (NormalizedCurrency currency : currencies) {
            if (!currency.isWrapped()) {
                unwrappedBySymbol.putIfAbsent(currency.getSymbol().toUpperCase(Locale.ROOT), currency);
            }
        }

        Map<NormalizedCurrency, List<BlockchainCurrency>> absorbed = new IdentityHashMap<>();
        Set<NormalizedCurrency> dropped = Collections.newSetFromMap(new IdentityHashMap<>());
        for (NormalizedCurrency currency : currencies) {
            if (!currency.isWrapped() || currency.getSymbol().length() < 2) {
                continue;
            }
            String underlying = currency.getSymbol().substring(1).toUpperCase(Locale.ROOT);
            NormalizedCurrency target = unwrappedBySymbol.get(underlying);
            if (target == null) {
                continue;
            }
            WrappedCurrency key = WrappedCurrency.of(currency);
            List<BlockchainCurrency> extra = absorbed.computeIfAbsent(target, t -> new ArrayList<>());
            for (BlockchainCurrency blockchain : currency.getBlockchains()) {
                extra.add(blockchain.withWrappedCurrency(key));
            }
            dropped.add(currency);
            log.debug("Linked wrapped {} to {}", currency.getSymbol(), target.getSymbol());
        }

        List<NormalizedCurrency> out = new ArrayList<>(currencies.size() - dropped.size());
        for (NormalizedCurrency currency : currencies) {
            if (dropped.contains(currency)) {
                continue;
            }
            List<BlockchainCurrency> extra = absorbed.get(currency);
            if (extra == null) {
                out.add(currency);
            } else {
                List<BlockchainCurrency> blockchains = new ArrayList<>(currency.getBlockchains());
                blockchains.addAll(extra);
                out.add(currency.withBlockchains(blockchains));
            }
        }
        return out;
    }
}
