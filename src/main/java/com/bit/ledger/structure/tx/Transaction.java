package com.bit.ledger.structure.tx;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 区块载荷中的一条交易：创建快照 / 字段补丁 / 删除标记 / 考勤记录
 * 每条交易带有自己的创建时间，与所在区块的时间戳相互独立
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"type", "data", "timestamp"})
public final class Transaction {

    private final TransactionType type;

    /**
     * 自由结构数据，字段随实体类型或考勤记录而定
     * 构造时逐层复制为只读结构，出块后任何调用方都改不动
     */
    private final Map<String, Object> data;

    private final long timestamp;

    @JsonCreator
    public Transaction(@JsonProperty("type") TransactionType type,
                       @JsonProperty("data") Map<String, Object> data,
                       @JsonProperty("timestamp") long timestamp) {
        this.type = Objects.requireNonNull(type, "交易类型不能为空");
        this.data = data == null ? Collections.emptyMap() : freezeMap(data);
        this.timestamp = timestamp;
    }

    public static Transaction of(TransactionType type, Map<String, Object> data) {
        return new Transaction(type, data, System.currentTimeMillis());
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof Collection<?> collection) {
            // 允许 null 元素，不能用 List.copyOf
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
