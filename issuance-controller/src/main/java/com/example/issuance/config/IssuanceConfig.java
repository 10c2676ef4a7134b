package com.example.issuance.config;

import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.registry.RegistryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the registry state machine. The registry state lives as long as the application context.
 */
@Configuration
public class IssuanceConfig {

    private static final Logger logger = LoggerFactory.getLogger(IssuanceConfig.class);

    @Bean
    public IssuancePolicy issuancePolicy(IssuanceProperties properties) {
        IssuancePolicy policy = properties.toPolicy();
        logger.info("Issuance policy: controller={}, maxIssuers={}, termLength={} blocks, baseFactor={}/{}, supplyFloor={}",
                policy.controllerAddress(), policy.maxIssuers(), policy.termLengthBlocks(),
                policy.baseFactor(), IssuancePolicy.FACTOR_SCALE, policy.supplyFloor());
        return policy;
    }

    @Bean
    public RegistryState registryState() {
        return new RegistryState();
    }

    @Bean
    public TransactionTemplate issuanceTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
