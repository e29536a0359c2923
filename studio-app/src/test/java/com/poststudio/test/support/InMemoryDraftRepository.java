package com.poststudio.test.support;

import com.poststudio.domain.draft.adapter.repository.IDraftRepository;
import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.domain.draft.model.valobj.DraftStatusStat;
import com.poststudio.types.enums.DraftStatusEnum;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存草稿仓储，存取均为拷贝，update 带版本校验。
 */
public class InMemoryDraftRepository implements IDraftRepository {

    private static final Comparator<DraftEntity> NEWEST_FIRST = Comparator
            .comparing(DraftEntity::getCreatedAt)
            .thenComparing(DraftEntity::getId)
            .reversed();

    private final Map<Long, DraftEntity> store = new LinkedHashMap<>();
    private long nextId = 1;
    private int updateCount;

    @Override
    public synchronized DraftEntity save(DraftEntity entity) {
        entity.validate();
        DraftEntity copied = entity.copy();
        copied.setId(nextId++);
        store.put(copied.getId(), copied);
        return copied.copy();
    }

    @Override
    public synchronized DraftEntity update(DraftEntity entity) {
        entity.validate();
        DraftEntity current = store.get(entity.getId());
        if (current == null || !Objects.equals(current.getVersion(), entity.getVersion())) {
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION,
                    "Optimistic lock failed for Draft: " + entity.getId());
        }
        entity.incrementVersion();
        store.put(entity.getId(), entity.copy());
        updateCount++;
        return entity.copy();
    }

    @Override
    public synchronized DraftEntity findById(Long id) {
        DraftEntity entity = store.get(id);
        return entity == null ? null : entity.copy();
    }

    @Override
    public synchronized List<DraftEntity> findAll() {
        return store.values().stream()
                .sorted(NEWEST_FIRST)
                .map(DraftEntity::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<DraftEntity> findByStatus(DraftStatusEnum status) {
        return store.values().stream()
                .filter(item -> item.getStatus() == status)
                .sorted(NEWEST_FIRST)
                .map(DraftEntity::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized DraftEntity findLatest() {
        return store.values().stream()
                .sorted(NEWEST_FIRST)
                .findFirst()
                .map(DraftEntity::copy)
                .orElse(null);
    }

    @Override
    public synchronized List<DraftEntity> findDueForPublish(LocalDateTime now, int limit) {
        return store.values().stream()
                .filter(item -> item.isDueForPublish(now))
                .sorted(Comparator.comparing(DraftEntity::getScheduledPublishAt).thenComparing(DraftEntity::getId))
                .limit(limit)
                .map(DraftEntity::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<DraftStatusStat> summarizeByStatus() {
        Map<DraftStatusEnum, Long> counts = new EnumMap<>(DraftStatusEnum.class);
        for (DraftEntity entity : store.values()) {
            counts.merge(entity.getStatus(), 1L, Long::sum);
        }
        List<DraftStatusStat> result = new ArrayList<>();
        counts.forEach((status, total) -> result.add(new DraftStatusStat(status, total)));
        return result;
    }

    public synchronized int getUpdateCount() {
        return updateCount;
    }
}
