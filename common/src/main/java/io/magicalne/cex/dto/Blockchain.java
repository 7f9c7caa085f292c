package io.magicalne.cex.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import io.magicalne.cex.exception.UnrecognizedBlockchainException;

import java.util.Locale;
import java.util.Map;

/**
 * Known chains a currency can be issued on. {@link #parse(String)} accepts the display name or any
 * alias, ignoring case, whitespace and punctuation.
 */
public enum Blockchain {
    ETHEREUM("Ethereum", "eth", "erc20"),
    BNB_SMART_CHAIN("BNB Smart Chain (BEP20)", "bnb smart chain", "bsc", "bep20", "binance smart chain"),
    BNB_BEACON_CHAIN("BNB Beacon Chain (BEP2)", "bnb beacon chain", "bep2"),
    BITCOIN("Bitcoin", "btc"),
    SOLANA("Solana", "sol", "spl"),
    TRON("Tron", "tron20", "trc20", "trx"),
    POLYGON("Polygon", "matic", "polygon pos"),
    AVALANCHE("Avalanche C-Chain", "avalanche", "avax", "avaxc"),
    ARBITRUM("Arbitrum", "arbitrum one", "arb"),
    OPTIMISM("Optimism", "op mainnet"),
    BASE("Base"),
    FANTOM("Fantom", "ftm"),
    CRONOS("Cronos", "cro"),
    TON("Toncoin", "ton"),
    NEAR("Near", "near protocol"),
    CARDANO("Cardano", "ada"),
    XRP_LEDGER("XRP Ledger", "xrp", "ripple"),
    STELLAR("Stellar", "xlm"),
    ALGORAND("Algorand", "algo"),
    COSMOS("Cosmos", "atom"),
    POLKADOT("Polkadot", "dot"),
    APTOS("Aptos", "apt"),
    SUI("Sui"),
    ZKSYNC("zkSync Era", "zksync"),
    LINEA("Linea"),
    KLAYTN("Klaytn", "klay"),
    CHILIZ("Chiliz", "chz"),
    VECHAIN("VeChain", "vet"),
    NEO("Neo"),
    ONTOLOGY("Ontology", "ont"),
    WAVES("Waves"),
    TEZOS("Tezos", "xtz"),
    HEDERA("Hedera Hashgraph", "hedera", "hbar"),
    FLOW("Flow"),
    ICP("Internet Computer", "icp"),
    BITCOIN_CASH("Bitcoin Cash", "bch"),
    HECO("Huobi ECO Chain", "heco"),
    OKT_CHAIN("OKT Chain", "okc", "okex chain"),
    GNOSIS("Gnosis Chain", "gnosis", "xdai"),
    MOONBEAM("Moonbeam", "glmr"),
    MOONRIVER("Moonriver", "movr"),
    CELO("Celo"),
    HARMONY("Harmony", "one"),
    KAVA("Kava"),
    OSMOSIS("Osmosis", "osmo"),
    INJECTIVE("Injective", "inj"),
    MANTLE("Mantle", "mnt"),
    BLAST("Blast"),
    SCROLL("Scroll"),
    STARKNET("Starknet"),
    MULTIVERSX("MultiversX", "elrond", "egld"),
    IOST("IOST"),
    EOS("EOS"),
    XDC("XDC Network", "xdc"),
    CONFLUX("Conflux", "cfx"),
    TERRA_CLASSIC("Terra Classic", "terra", "lunc"),
    ETHEREUM_CLASSIC("Ethereum Classic", "etc"),
    ZILLIQA("Zilliqa", "zil"),
    METIS("Metis Andromeda", "metis"),
    BITTORRENT("BitTorrent-New", "bittorrent", "bttc");

    private static final CharMatcher KEY_CHARS = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9'));
    private static final Map<String, Blockchain> BY_KEY = index();

    private final String displayName;
    private final String[] aliases;

    Blockchain(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static Blockchain parse(String name) {
        Blockchain blockchain = name == null ? null : BY_KEY.get(key(name));
        if (blockchain == null) {
            throw new UnrecognizedBlockchainException(name);
        }
        return blockchain;
    }

    private static String key(String name) {
        return KEY_CHARS.retainFrom(name.toLowerCase(Locale.ROOT));
    }

    private static Map<String, Blockchain> index() {
        ImmutableMap.Builder<String, Blockchain> builder = ImmutableMap.builder();
        for (Blockchain blockchain : values()) {
            builder.put(key(blockchain.displayName), blockchain);
            builder.put(key(blockchain.name()), blockchain);
            for (String alias : blockchain.aliases) {
                builder.put(key(alias), blockchain);
            }
        }
        return builder.buildKeepingLast();
    }
}
