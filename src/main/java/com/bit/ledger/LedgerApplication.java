package com.bit.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.ledger")
public class LedgerApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(LedgerApplication.class, args);
        log.info("账本启动耗时{}ms", System.currentTimeMillis() - start);
    }
}
