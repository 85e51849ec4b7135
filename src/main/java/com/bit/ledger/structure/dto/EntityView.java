package com.bit.ledger.structure.dto;

import com.bit.ledger.blockchain.EntityChain;
import com.bit.ledger.blockchain.GroupChain;
import com.bit.ledger.blockchain.LeafChain;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 实体对外视图：回放后的当前状态 + 链元信息
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntityView {
    private String id;
    private String type;
    private String name;
    private String status;
    private String departmentId;
    private String classId;
    private Map<String, Object> state;
    private int chainLength;
    private int difficulty;
    private String latestHash;
    private String parentLinkHash;
    private long createdAt;

    public static EntityView of(EntityChain entity) {
        EntityView view = new EntityView();
        view.setId(entity.getId());
        view.setType(entity.getKind().getLabel());
        view.setName(entity.getCurrentName());
        view.setStatus(entity.getStatus());
        if (entity instanceof GroupChain group) {
            view.setDepartmentId(group.getRootId());
        } else if (entity instanceof LeafChain leaf) {
            view.setDepartmentId(leaf.getRootId());
            view.setClassId(leaf.getGroupId());
        }
        Map<String, Object> state = entity.getCurrentState();
        view.setState(state == null ? Map.of() : new LinkedHashMap<>(state));
        view.setChainLength(entity.getChainLength());
        view.setDifficulty(entity.getChain().getDifficulty());
        view.setLatestHash(entity.getChain().isEmpty() ? null : entity.getLatestHash());
        view.setParentLinkHash(entity.getParentLinkHash());
        view.setCreatedAt(entity.getCreatedAt());
        return view;
    }
}
