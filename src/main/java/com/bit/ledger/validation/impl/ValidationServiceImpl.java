package com.bit.ledger.validation.impl;

import com.bit.ledger.blockchain.Chain;
import com.bit.ledger.blockchain.ChainRegistry;
import com.bit.ledger.blockchain.ChainVerification;
import com.bit.ledger.blockchain.EntityChain;
import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.blockchain.GroupChain;
import com.bit.ledger.blockchain.LeafChain;
import com.bit.ledger.blockchain.RootChain;
import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import com.bit.ledger.structure.block.Block;
import com.bit.ledger.validation.SystemValidationResult;
import com.bit.ledger.validation.ValidationResult;
import com.bit.ledger.validation.ValidationService;
import com.bit.ledger.validation.ValidationState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 级联校验实现
 * 工作量证明使用每条链自己存储的难度，不使用全局常量
 * 同一次调用内父链结果只算一次；整链校验结果按链对象缓存，链未增长时直接复用
 */
@Slf4j
public class ValidationServiceImpl implements ValidationService {

    private final ChainRegistry registry;

    /**
     * key=链对象（按引用比较），value=校验时的最新哈希和结果
     */
    private final Cache<Chain, CheckedChain> verificationCache = Caffeine.newBuilder()
            .weakKeys()
            .maximumSize(10_000)
            .recordStats()
            .build();

    private final AtomicLong fullVerifications = new AtomicLong();

    public ValidationServiceImpl(ChainRegistry registry) {
        this.registry = registry;
    }

    @Override
    public ValidationResult validateRoot(String id) {
        return validateRoot(registry.getRoot(id), new HashMap<>());
    }

    @Override
    public ValidationResult validateGroup(String id) {
        return validateGroup(registry.getGroup(id), new HashMap<>());
    }

    @Override
    public ValidationResult validateLeaf(String id) {
        return validateLeaf(registry.getLeaf(id), new HashMap<>());
    }

    @Override
    public ValidationResult validate(EntityKind kind, String id) {
        switch (kind) {
            case ROOT:
                return validateRoot(id);
            case GROUP:
                return validateGroup(id);
            case LEAF:
                return validateLeaf(id);
            default:
                throw new IllegalArgumentException("未知实体类型: " + kind);
        }
    }

    @Override
    public ValidationResult requireValid(EntityKind kind, String id) {
        ValidationResult result = validate(kind, id);
        if (!result.isValid()) {
            throw new LedgerException(ErrorType.INTEGRITY_FAILURE,
                    kind.getLabel() + " " + id + ": " + String.join("; ", result.getErrors()));
        }
        return result;
    }

    @Override
    public SystemValidationResult validateSystem() {
        SystemValidationResult report = new SystemValidationResult();
        SystemValidationResult.Summary summary = report.getSummary();
        SystemValidationResult.InvalidEntities invalid = report.getInvalidEntities();
        Map<String, ValidationResult> memo = new HashMap<>();

        for (RootChain root : registry.listRoots()) {
            ValidationResult result = validateRoot(root, memo);
            report.getDetails().add(result);
            summary.setTotalDepartments(summary.getTotalDepartments() + 1);
            if (result.isValid()) {
                summary.setValidDepartments(summary.getValidDepartments() + 1);
            } else {
                invalid.getDepartments().add(root.getId());
            }
        }
        for (GroupChain group : registry.listGroups()) {
            ValidationResult result = validateGroup(group, memo);
            report.getDetails().add(result);
            summary.setTotalClasses(summary.getTotalClasses() + 1);
            if (result.isValid()) {
                summary.setValidClasses(summary.getValidClasses() + 1);
            } else {
                invalid.getClasses().add(group.getId());
            }
        }
        for (LeafChain leaf : registry.listLeaves()) {
            ValidationResult result = validateLeaf(leaf, memo);
            report.getDetails().add(result);
            summary.setTotalStudents(summary.getTotalStudents() + 1);
            if (result.isValid()) {
                summary.setValidStudents(summary.getValidStudents() + 1);
            } else {
                invalid.getStudents().add(leaf.getId());
            }
        }
        report.setValid(invalid.getDepartments().isEmpty()
                && invalid.getClasses().isEmpty()
                && invalid.getStudents().isEmpty());

        log.info("System validation complete: departments {}/{}, classes {}/{}, students {}/{}",
                summary.getValidDepartments(), summary.getTotalDepartments(),
                summary.getValidClasses(), summary.getTotalClasses(),
                summary.getValidStudents(), summary.getTotalStudents());
        if (!report.isValid()) {
            log.error("System validation failed: {}", invalid);
        }
        return report;
    }

    /**
     * 实际执行过的整链校验次数（缓存未命中次数）
     */
    public long getFullVerificationCount() {
        return fullVerifications.get();
    }

    private ValidationResult validateRoot(RootChain root, Map<String, ValidationResult> memo) {
        String memoKey = memoKey(root);
        ValidationResult cached = memo.get(memoKey);
        if (cached != null) {
            return cached;
        }
        ValidationResult result = start(root);
        memo.put(memoKey, result);
        if (result.getState().isTerminal()) {
            return result;
        }

        Block genesis = root.getChain().getGenesisBlock();
        if (Chain.ROOT_MARKER.equals(genesis.getPrevHash())) {
            result.getDetails().setGenesisValid(true);
        } else {
            result.getDetails().setGenesisValid(false);
            result.error("Genesis block has invalid prev_hash: " + genesis.getPrevHash() + " (should be '0')");
        }
        checkChain(root, result);
        return report(result.finish());
    }

    private ValidationResult validateGroup(GroupChain group, Map<String, ValidationResult> memo) {
        String memoKey = memoKey(group);
        ValidationResult cached = memo.get(memoKey);
        if (cached != null) {
            return cached;
        }
        ValidationResult result = start(group);
        memo.put(memoKey, result);
        if (result.getState().isTerminal()) {
            return result;
        }

        checkChildGenesis(group, result);
        checkChain(group, result);

        Optional<EntityChain> parent = registry.find(EntityKind.ROOT, group.getRootId());
        if (parent.isEmpty()) {
            result.error("Parent department " + group.getRootId() + " not found");
            return report(result.finish());
        }
        checkParentLink(group, parent.get(), result);

        ValidationResult parentResult = validateRoot((RootChain) parent.get(), memo);
        checkParentValidity(group, parentResult, result);
        return report(result.finish());
    }

    private ValidationResult validateLeaf(LeafChain leaf, Map<String, ValidationResult> memo) {
        String memoKey = memoKey(leaf);
        ValidationResult cached = memo.get(memoKey);
        if (cached != null) {
            return cached;
        }
        ValidationResult result = start(leaf);
        memo.put(memoKey, result);
        if (result.getState().isTerminal()) {
            return result;
        }
        String rollNumber = leaf.getRollNumber();
        if (rollNumber != null) {
            result.setEntityName(result.getEntityName() + " (" + rollNumber + ")");
        }

        checkChildGenesis(leaf, result);
        checkChain(leaf, result);

        Optional<EntityChain> parent = registry.find(EntityKind.GROUP, leaf.getGroupId());
        if (parent.isEmpty()) {
            result.error("Parent class " + leaf.getGroupId() + " not found");
            return report(result.finish());
        }
        checkParentLink(leaf, parent.get(), result);

        ValidationResult parentResult = validateGroup((GroupChain) parent.get(), memo);
        checkParentValidity(leaf, parentResult, result);

        result.warning(leaf.getRecordHistory().size() + " attendance records found");
        return report(result.finish());
    }

    /**
     * 填充基本信息，空链直接判为无效
     */
    private ValidationResult start(EntityChain entity) {
        ValidationResult result = new ValidationResult(entity.getKind(), entity.getId());
        result.setEntityName(entity.getCurrentName());
        result.getDetails().setChainLength(entity.getChainLength());
        result.getDetails().setDifficulty(entity.getChain().getDifficulty());
        if (entity.getChain().isEmpty()) {
            result.error("Chain is empty");
            result.advance(ValidationState.INVALID);
            return report(result);
        }
        return result;
    }

    private void checkChildGenesis(EntityChain entity, ValidationResult result) {
        Block genesis = entity.getChain().getGenesisBlock();
        boolean genesisValid = genesis.getIndex() == 0 && genesis.isValid();
        result.getDetails().setGenesisValid(genesisValid);
        if (!genesisValid) {
            result.error("Genesis block is invalid");
        }
    }

    /**
     * 整链完整性 + 逐块工作量证明，完成后进入 CHAIN_CHECKED
     */
    private void checkChain(EntityChain entity, ValidationResult result) {
        Chain chain = entity.getChain();
        ChainVerification verification = verify(chain);
        result.getDetails().setChainIntegrity(verification.isValid());
        if (!verification.isValid()) {
            log.error("{} {} failed integrity check: {}", entity.getKind().getLabel(), entity.getId(),
                    verification.describe());
            result.error("Chain integrity check failed - tampering detected (" + verification.describe() + ")");
        }

        boolean proofOfWork = true;
        for (Block block : chain.getBlocks()) {
            if (!block.meetsDifficulty(chain.getDifficulty())) {
                proofOfWork = false;
                result.error("Block " + block.getIndex() + " doesn't satisfy Proof of Work requirement");
            }
        }
        result.getDetails().setProofOfWork(proofOfWork);
        result.advance(ValidationState.CHAIN_CHECKED);
    }

    /**
     * 父子绑定：创世块 prev_hash 等于记录的父链哈希，且该哈希仍在父链中
     * 父链之后继续出块只给提示
     */
    private void checkParentLink(EntityChain child, EntityChain parent, ValidationResult result) {
        String parentLabel = parent.getKind().getLabel();
        String childLabel = child.getKind().getLabel();
        String parentLatest = parent.getChain().isEmpty() ? null : parent.getLatestHash();

        boolean linked = child.validateParentLink(parentLatest);
        result.getDetails().setParentLink(linked);
        if (!linked) {
            result.error("Parent link validation failed - " + childLabel + " not properly linked to " + parentLabel);
        }

        boolean anchored = parent.getChain().containsHash(child.getParentLinkHash());
        result.getDetails().setParentAnchored(anchored);
        if (!anchored) {
            result.error("Linked " + parentLabel + " block " + child.getParentLinkHash() + " not found in parent chain");
        }

        if (linked && child.parentHasGrown(parentLatest)) {
            result.warning("Parent " + parentLabel + " chain has grown since " + childLabel + " creation");
        }
        result.advance(ValidationState.PARENT_LINK_CHECKED);
    }

    private void checkParentValidity(EntityChain child, ValidationResult parentResult, ValidationResult result) {
        result.getDetails().setParentValid(parentResult.isValid());
        if (!parentResult.isValid()) {
            String parentLabel = parentResult.getEntityType();
            result.error("Parent " + parentLabel + " chain is invalid");
            result.warning(capitalize(child.getKind().getLabel()) + " chain depends on invalid parent - hierarchy broken");
        }
    }

    private ChainVerification verify(Chain chain) {
        String latest = chain.isEmpty() ? null : chain.getLatestBlock().getHash();
        CheckedChain checked = verificationCache.getIfPresent(chain);
        if (checked != null
                && checked.verification.getCheckedLength() == chain.length()
                && checked.latestHash != null && checked.latestHash.equals(latest)) {
            return checked.verification;
        }
        ChainVerification verification = chain.verify();
        fullVerifications.incrementAndGet();
        if (verification.getCheckedLength() == chain.length()) {
            verificationCache.put(chain, new CheckedChain(latest, verification));
        }
        return verification;
    }

    private ValidationResult report(ValidationResult result) {
        if (result.isValid()) {
            log.info("{} {} validation passed", result.getEntityType(), result.getEntityId());
        } else {
            log.warn("{} {} validation failed: {}", result.getEntityType(), result.getEntityId(), result.getErrors());
        }
        return result;
    }

    private static String memoKey(EntityChain entity) {
        return entity.getKind().name() + ":" + entity.getId();
    }

    private static String capitalize(String label) {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    private static final class CheckedChain {
        private final String latestHash;
        private final ChainVerification verification;

        private CheckedChain(String latestHash, ChainVerification verification) {
            this.latestHash = latestHash;
            this.verification = verification;
        }
    }
}
