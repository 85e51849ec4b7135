package com.bit.ledger.exception;

public enum ErrorType {
    NOT_FOUND("实体不存在（链或父链缺失）"),
    CONFLICT("冲突（ID重复或同一日期重复考勤）"),
    INTEGRITY_FAILURE("完整性校验失败（哈希/链接/工作量证明不匹配）"),
    INPUT_ERROR("输入非法（载荷缺少必填字段或字段不允许修改）"),
    PERSIST_FAILED("数据持久化失败（快照文件读写异常）"),
    MINING_FAILED("出块任务执行失败（挖矿线程异常或被中断）"),
    CONFIG_INVALID("账本配置无效（如难度越界/存储路径不可用）");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
