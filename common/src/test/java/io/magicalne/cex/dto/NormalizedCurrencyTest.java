package io.magicalne.cex.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.magicalne.cex.Utils;
import org.junit.Assert;
import org.junit.Test;

public class NormalizedCurrencyTest {

    private final ObjectMapper mapper = Utils.objectMapper();

    @Test
    public void serializesSnakeCaseFields() {
        NormalizedCurrency btc = new NormalizedCurrency(CexExchange.BINANCE, "BTC", "Bitcoin", null,
                "last updated: 2024-05-01T12:00:00Z",
                ImmutableList.of(new BlockchainCurrency(Blockchain.ETHEREUM, "0x2260", true,
                        new WrappedCurrency("WBTC", "Wrapped Bitcoin"))));

        JsonNode json = mapper.valueToTree(btc);

        Assert.assertEquals("binance", json.get("exchange").asText());
        Assert.assertFalse(json.has("display_name"));
        JsonNode platform = json.get("blockchains").get(0);
        Assert.assertEquals("Ethereum", platform.get("blockchain").asText());
        Assert.assertTrue(platform.get("is_wrapped").asBoolean());
        Assert.assertEquals("WBTC", platform.get("wrapped_currency").get("symbol").asText());
        Assert.assertFalse(platform.has("linked_wrapped"));
        Assert.assertFalse(json.has("wrapped"));
    }

    @Test
    public void readsReferenceRecord() throws Exception {
        String json = "{\"exchange\":\"binance\",\"symbol\":\"ETH\",\"name\":\"Ethereum\",\"display_name\":\"Ether\","
                + "\"status\":\"listed\",\"blockchains\":[{\"blockchain\":\"Arbitrum\",\"address\":\"0x82af\","
                + "\"is_wrapped\":true,\"wrapped_currency\":{\"symbol\":\"WETH\",\"name\":\"Wrapped Ether\"}}]}";

        NormalizedCurrency eth = mapper.readValue(json, NormalizedCurrency.class);

        Assert.assertEquals(CexExchange.BINANCE, eth.getExchange());
        Assert.assertEquals("Ether", eth.getDisplayName());
        Assert.assertEquals(Blockchain.ARBITRUM, eth.getBlockchains().get(0).getBlockchain());
        Assert.assertTrue(eth.hasLinkedWrapped());
    }

    @Test
    public void pairSerializesDelimiterAsString() {
        JsonNode json = mapper.valueToTree(NormalizedTradingPair.ofPair(CexExchange.BINANCE, "BTC-USDT", '-'));

        Assert.assertEquals("BTC-USDT", json.get("pair").asText());
        Assert.assertEquals("-", json.get("delimiter").asText());
        Assert.assertFalse(json.has("base"));
    }

    @Test
    public void linkedWrappedNeedsWrappedLookingKey() {
        BlockchainCurrency odd = new BlockchainCurrency(Blockchain.ETHEREUM, null, true,
                new WrappedCurrency("STETH", "Lido Staked ETH"));
        Assert.assertFalse(odd.isLinkedWrapped());
    }
}
