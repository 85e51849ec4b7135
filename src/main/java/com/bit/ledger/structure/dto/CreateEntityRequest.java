package com.bit.ledger.structure.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 创建部门/班级/学生的请求体
 * id 缺省时自动生成；其余业务字段（code、semester、rollNumber、email 等）收集到 fields
 */
@Data
public class CreateEntityRequest {
    private String id;
    private String name;
    private String departmentId;
    private String classId;

    private Map<String, Object> fields = new LinkedHashMap<>();

    @JsonAnySetter
    public void putField(String key, Object value) {
        fields.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }
}
