package com.bit.ledger.database.json;

import com.bit.ledger.blockchain.EntityKind;
import com.bit.ledger.database.ChainRecord;
import com.bit.ledger.database.ChainStore;
import com.bit.ledger.exception.ErrorType;
import com.bit.ledger.exception.LedgerException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON 文件快照：roots.json / groups.json / leaves.json
 * 先写同目录临时文件再原子替换，崩溃时可见文件要么是旧快照要么是新快照
 */
@Slf4j
public class JsonFileChainStore implements ChainStore {

    private static final TypeReference<List<ChainRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final Path directory;

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    /**
     * 文件写入串行化
     */
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileChainStore(String path) {
        this.directory = Paths.get(path).toAbsolutePath().normalize();
    }

    @Override
    public void open() {
        try {
            Files.createDirectories(directory);
            for (EntityKind kind : EntityKind.values()) {
                Path file = fileOf(kind);
                if (Files.notExists(file)) {
                    writeAtomically(file, List.of());
                    log.info("Initialized {}", file.getFileName());
                }
            }
        } catch (IOException e) {
            throw new LedgerException(ErrorType.CONFIG_INVALID, "存储目录不可用: " + directory, e);
        }
        log.info("系统数据路径:{}", directory);
    }

    @Override
    public List<ChainRecord> load(EntityKind kind) {
        Path file = fileOf(kind);
        if (Files.notExists(file)) {
            log.warn("File not found: {}, returning empty list", file.getFileName());
            return List.of();
        }
        try {
            List<ChainRecord> records = mapper.readValue(file.toFile(), RECORD_LIST);
            return records == null ? List.of() : records;
        } catch (IOException e) {
            // 读不出来不能当成空集合，否则下一次写入会覆盖掉原数据
            throw new LedgerException(ErrorType.PERSIST_FAILED, "读取快照失败: " + file, e);
        }
    }

    @Override
    public void save(EntityKind kind, List<ChainRecord> records) {
        Path file = fileOf(kind);
        writeLock.lock();
        try {
            writeAtomically(file, records);
            log.debug("Saved {} ({} chains)", file.getFileName(), records.size());
        } catch (IOException e) {
            throw new LedgerException(ErrorType.PERSIST_FAILED, "写入快照失败: " + file, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String describe() {
        return "json:" + directory;
    }

    public Path fileOf(EntityKind kind) {
        return directory.resolve(kind.getFileName());
    }

    private void writeAtomically(Path file, List<ChainRecord> records) throws IOException {
        Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), records);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported on {}, falling back to replace", directory);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
