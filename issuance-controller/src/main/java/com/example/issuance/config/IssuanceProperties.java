package com.example.issuance.config;

import com.example.issuance.model.Address;
import com.example.issuance.model.IssuancePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

@Configuration
@ConfigurationProperties(prefix = "issuance")
public class IssuanceProperties {

    private String controllerAddress;
    private Registry registry = new Registry();
    private Mint mint = new Mint();

    public static class Registry {
        private int maxIssuers = 10;
        private long termLengthBlocks = 100_000;
        private int earlyExitThresholdPercent = 95;

        public int getMaxIssuers() {
            return maxIssuers;
        }

        public void setMaxIssuers(int maxIssuers) {
            this.maxIssuers = maxIssuers;
        }

        public long getTermLengthBlocks() {
            return termLengthBlocks;
        }

        public void setTermLengthBlocks(long termLengthBlocks) {
            this.termLengthBlocks = termLengthBlocks;
        }

        public int getEarlyExitThresholdPercent() {
            return earlyExitThresholdPercent;
        }

        public void setEarlyExitThresholdPercent(int earlyExitThresholdPercent) {
            this.earlyExitThresholdPercent = earlyExitThresholdPercent;
        }
    }

    public static class Mint {
        private long baseFactor = 1000;       // 10% of supply
        private long burnBonus = 100;         // 1% per conservative-issuer condition
        private long lowMintThreshold = 200;  // 2% of supply
        private BigInteger supplyFloor = new BigInteger("1000000000000000000000000");

        public long getBaseFactor() {
            return baseFactor;
        }

        public void setBaseFactor(long baseFactor) {
            this.baseFactor = baseFactor;
        }

        public long getBurnBonus() {
            return burnBonus;
        }

        public void setBurnBonus(long burnBonus) {
            this.burnBonus = burnBonus;
        }

        public long getLowMintThreshold() {
            return lowMintThreshold;
        }

        public void setLowMintThreshold(long lowMintThreshold) {
            this.lowMintThreshold = lowMintThreshold;
        }

        public BigInteger getSupplyFloor() {
            return supplyFloor;
        }

        public void setSupplyFloor(BigInteger supplyFloor) {
            this.supplyFloor = supplyFloor;
        }
    }

    /**
     * Freezes the bound values into the immutable policy used by the controller.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public IssuancePolicy toPolicy() {
        return new IssuancePolicy(
                Address.of(controllerAddress),
                registry.getMaxIssuers(),
                registry.getTermLengthBlocks(),
                registry.getEarlyExitThresholdPercent(),
                mint.getBaseFactor(),
                mint.getBurnBonus(),
                mint.getLowMintThreshold(),
                mint.getSupplyFloor()
        );
    }

    public String getControllerAddress() {
        return controllerAddress;
    }

    public void setControllerAddress(String controllerAddress) {
        this.controllerAddress = controllerAddress;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Mint getMint() {
        return mint;
    }

    public void setMint(Mint mint) {
        this.mint = mint;
    }
}
