package com.bit.ledger.config;

import com.bit.ledger.blockchain.Chain;
import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Data
@Component
@Order(0)
@ConfigurationProperties(prefix = "ledger")
public class LedgerConfig {
    /**
     * 挖矿难度：哈希前导 '0' 个数，0..6
     */
    private int difficulty = 4;

    private String storagePath = "./storage";//快照保存路径

    private String storageType = "file";//file / memory

    private int miningThreads = Runtime.getRuntime().availableProcessors();

    private int miningQueueCapacity = 1024;

    /**
     * 启动加载完成后做一次全系统校验并打印结果
     */
    private boolean verifyOnStartup = true;

    @PostConstruct
    public void init() {
        if (difficulty < 0 || difficulty > Chain.MAX_DIFFICULTY) {
            throw new LedgerException(ErrorType.CONFIG_INVALID,
                    "ledger.difficulty must be between 0 and " + Chain.MAX_DIFFICULTY + ": " + difficulty);
        }
        if (!"file".equalsIgnoreCase(storageType) && !"memory".equalsIgnoreCase(storageType)) {
            throw new LedgerException(ErrorType.CONFIG_INVALID, "ledger.storage-type must be file or memory: " + storageType);
        }
        if ("file".equalsIgnoreCase(storageType) && (storagePath == null || storagePath.isBlank())) {
            throw new LedgerException(ErrorType.CONFIG_INVALID, "ledger.storage-path is required for file storage");
        }
        if (miningThreads <= 0) {
            throw new LedgerException(ErrorType.CONFIG_INVALID, "ledger.mining-threads must be positive: " + miningThreads);
        }
        log.info("Ledger config: difficulty={}, storage={}:{}, miningThreads={}", difficulty, storageType, storagePath, miningThreads);
    }

    public boolean isMemoryStorage() {
        return "memory".equalsIgnoreCase(storageType);
    }
}
