package com.bit.ledger.util;

import org.bouncycastle.util.encoders.Hex;

import java.security.SecureRandom;

/**
 * 实体ID生成：前缀_毫秒时间戳(36进制)_4字节随机数(hex)，例如 dept_m3k2j1x0_9f3a01bc
 */
public final class IdGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {
    }

    public static String generateId(String prefix) {
        byte[] random = new byte[4];
        RANDOM.nextBytes(random);
        return prefix + "_" + Long.toString(System.currentTimeMillis(), 36) + "_" + Hex.toHexString(random);
    }
}
