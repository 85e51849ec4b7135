package com.bit.ledger.database;

import com.bit.ledger.structure.block.Block;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 快照文件中的一条实体链记录
 * 根链没有 root_id / group_id / parent_link_hash，序列化时省略
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "display_name", "root_id", "group_id", "parent_link_hash", "difficulty", "chain"})
public class ChainRecord {

    private String id;

    @JsonProperty("display_name")
    private String displayName;

    /**
     * 所属部门：班级、学生记录都有
     */
    @JsonProperty("root_id")
    private String rootId;

    /**
     * 所属班级：仅学生记录
     */
    @JsonProperty("group_id")
    private String groupId;

    @JsonProperty("parent_link_hash")
    private String parentLinkHash;

    private int difficulty;

    private List<Block> chain;
}
