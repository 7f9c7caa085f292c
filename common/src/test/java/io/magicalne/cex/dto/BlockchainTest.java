package io.magicalne.cex.dto;

import io.magicalne.cex.exception.UnrecognizedBlockchainException;
import org.junit.Assert;
import org.junit.Test;

public class BlockchainTest {

    @Test
    public void parsesDisplayNames() {
        Assert.assertEquals(Blockchain.ETHEREUM, Blockchain.parse("Ethereum"));
        Assert.assertEquals(Blockchain.BNB_SMART_CHAIN, Blockchain.parse("BNB Smart Chain (BEP20)"));
        Assert.assertEquals(Blockchain.AVALANCHE, Blockchain.parse("Avalanche C-Chain"));
    }

    @Test
    public void parsesAliasesIgnoringCaseAndPunctuation() {
        Assert.assertEquals(Blockchain.BNB_SMART_CHAIN, Blockchain.parse("bnb-smart-chain"));
        Assert.assertEquals(Blockchain.BNB_SMART_CHAIN, Blockchain.parse("BSC"));
        Assert.assertEquals(Blockchain.TRON, Blockchain.parse("TRC20"));
        Assert.assertEquals(Blockchain.ETHEREUM, Blockchain.parse(" ethereum "));
    }

    @Test
    public void unknownChainFails() {
        try {
            Blockchain.parse("Atlantis Chain");
            Assert.fail("expected UnrecognizedBlockchainException");
        } catch (UnrecognizedBlockchainException e) {
            Assert.assertEquals("Atlantis Chain", e.getName());
        }
    }

    @Test(expected = UnrecognizedBlockchainException.class)
    public void nullChainFails() {
        Blockchain.parse(null);
    }
}
