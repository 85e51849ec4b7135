package com.bit.ledger.config;

import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.MiningWorkerPool;
import com.bit.ledger.blockchain.impl.ChainRegistryImpl;
import com.bit.ledger.database.ChainStore;
import com.bit.ledger.database.json.JsonFileChainStore;
import com.bit.ledger.database.memory.MemoryChainStore;
import com.bit.ledger.service.LedgerQueryService;
import com.bit.ledger.service.impl.LedgerQueryServiceImpl;
import com.bit.ledger.validation.SystemValidationResult;
import com.bit.ledger.validation.ValidationService;
import com.bit.ledger.validation.impl.ValidationServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 账本组件装配：启动时显式构造一次，随容器关闭销毁
 */
@Slf4j
@Configuration
public class LedgerBeans {

    @Bean
    public ChainStore chainStore(LedgerConfig config) {
        if (config.isMemoryStorage()) {
            return new MemoryChainStore();
        }
        return new JsonFileChainStore(config.getStoragePath());
    }

    @Bean(destroyMethod = "close")
    public MiningWorkerPool miningWorkerPool(LedgerConfig config) {
        return new MiningWorkerPool(config.getMiningThreads(), config.getMiningQueueCapacity());
    }

    @Bean
    public ChainRegistry chainRegistry(LedgerConfig config, ChainStore chainStore, MiningWorkerPool miningWorkerPool) {
        ChainRegistryImpl registry = new ChainRegistryImpl(config.getDifficulty(), chainStore, miningWorkerPool);
        registry.load();
        return registry;
    }

    @Bean
    public ValidationService validationService(ChainRegistry chainRegistry) {
        return new ValidationServiceImpl(chainRegistry);
    }

    @Bean
    public LedgerQueryService ledgerQueryService(ChainRegistry chainRegistry) {
        return new LedgerQueryServiceImpl(chainRegistry);
    }

    @Bean
    public ApplicationRunner startupVerification(LedgerConfig config, ValidationService validationService) {
        return args -> {
            if (!config.isVerifyOnStartup()) {
                return;
            }
            SystemValidationResult report = validationService.validateSystem();
            if (!report.isValid()) {
                log.warn("Ledger loaded with integrity failures: {}", report.getInvalidEntities());
            }
        };
    }
}
