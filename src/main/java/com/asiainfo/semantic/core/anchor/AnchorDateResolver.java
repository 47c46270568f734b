package com.asiainfo.semantic.core.anchor;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.engine.RowAccessor;
import com.asiainfo.semantic.core.exception.NoAnchorException;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.TableData;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 锚点日期解析
 * 锚点 = 事实表锚点列非空值的最大值，作为相对时间窗口的"今天"。
 * 锚点列可在事实表上，也可在经外键关联的维度表上（取被非空外键引用的维度行的最大日期）。
 * 结果按快照缓存；快照替换后随旧快照一起失效。
 */
public final class AnchorDateResolver {

    private static final Logger log = LoggerFactory.getLogger(AnchorDateResolver.class);

    // 默认锚点列的命名优先级，越靠前越优先
    private static final String[] COLUMN_HINTS = {"submitted", "sent", "closed", "created", "calendar", "date"};

    private final SemanticModel model;
    private final Cache<AnchorKey, Optional<LocalDate>> cache;

    private record AnchorKey(String fact, ColumnRef column, String selector) {}

    public AnchorDateResolver(SemanticModel model, long cacheSize) {
        this.model = model;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .build();
    }

    /**
     * 事实表默认锚点
     *
     * @throws NoAnchorException 没有可用的锚点列，或锚点列全为空
     */
    public LocalDate anchor(String fact) {
        ColumnRef column = defaultAnchorColumn(fact)
                .orElseThrow(() -> new NoAnchorException(fact, null));
        return anchor(fact, column, null);
    }

    public LocalDate anchor(String fact, ColumnRef column) {
        return anchor(fact, column, null);
    }

    /**
     * @param selector 锚点列在维度表上且关系有歧义时使用的关系
     * @throws NoAnchorException 锚点列全为空，不做任何静默兜底
     */
    public LocalDate anchor(String fact, ColumnRef column, String selector) {
        return findAnchor(fact, column, selector)
                .orElseThrow(() -> new NoAnchorException(fact, column.toString()));
    }

    public Optional<LocalDate> findAnchor(String fact) {
        return defaultAnchorColumn(fact).flatMap(col -> findAnchor(fact, col, null));
    }

    public Optional<LocalDate> findAnchor(String fact, ColumnRef column, String selector) {
        return cache.get(new AnchorKey(fact, column, selector), this::compute);
    }

    /**
     * 锚点列：优先使用声明的列，否则按列名启发式在有数据的日期列中挑选
     */
    public Optional<ColumnRef> defaultAnchorColumn(String fact) {
        FactTable table = model.schema().requireFact(fact);
        if (table.anchorColumn() != null) {
            return Optional.of(table.anchorColumn());
        }
        List<ColumnRef> candidates = new ArrayList<>();
        for (ColumnDef col : table.columns()) {
            if (col.type() == ColumnType.DATE) {
                candidates.add(ColumnRef.of(fact, col.name()));
            }
        }
        // 事实表没有日期列时，再看唯一关系可达的维度日期列
        if (candidates.isEmpty()) {
            for (String dim : model.graph().resolutionOrder(fact)) {
                if (model.graph().isAmbiguous(fact, dim)) continue;
                for (ColumnDef col : model.schema().requireDimension(dim).columns()) {
                    if (col.type() == ColumnType.DATE) {
                        candidates.add(ColumnRef.of(dim, col.name()));
                    }
                }
            }
        }

        ColumnRef best = null;
        int bestScore = -1;
        for (ColumnRef candidate : candidates) {
            if (findAnchor(fact, candidate, null).isEmpty()) {
                continue;
            }
            int score = score(candidate.column());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("[Anchor] {} has no declared anchor column, picked {}", fact, best);
        }
        return Optional.ofNullable(best);
    }

    /**
     * 锚点列画像：最小、最大、锚点、非空数及 7/30/90 天窗口内行数
     */
    public AnchorProfile profile(String fact, ColumnRef column, String selector) {
        TableData data = model.data(fact);
        RowAccessor accessor = model.accessor(fact, column, selector);
        List<LocalDate> dates = new ArrayList<>();
        for (int r = 0; r < data.rowCount(); r++) {
            Object v = accessor.get(r);
            if (v instanceof LocalDate) {
                dates.add((LocalDate) v);
            }
        }
        if (dates.isEmpty()) {
            return new AnchorProfile(fact, column, data.rowCount(), 0, null, null, null, 0, 0, 0);
        }
        LocalDate min = dates.get(0);
        LocalDate max = dates.get(0);
        for (LocalDate d : dates) {
            if (d.isBefore(min)) min = d;
            if (d.isAfter(max)) max = d;
        }
        return new AnchorProfile(fact, column, data.rowCount(), dates.size(), min, max, max,
                countWithin(dates, DateWindow.lastDays(max, 7)),
                countWithin(dates, DateWindow.lastDays(max, 30)),
                countWithin(dates, DateWindow.lastDays(max, 90)));
    }

    public AnchorProfile profile(String fact) {
        ColumnRef column = defaultAnchorColumn(fact)
                .orElseThrow(() -> new NoAnchorException(fact, null));
        return profile(fact, column, null);
    }

    private Optional<LocalDate> compute(AnchorKey key) {
        TableData data = model.data(key.fact());
        RowAccessor accessor = model.accessor(key.fact(), key.column(), key.selector());
        LocalDate max = null;
        for (int r = 0; r < data.rowCount(); r++) {
            Object v = accessor.get(r);
            if (v instanceof LocalDate d && (max == null || d.isAfter(max))) {
                max = d;
            }
        }
        if (max == null) {
            log.warn("[Anchor] {} has no non-blank value in {}", key.fact(), key.column());
        } else {
            log.debug("[Anchor] {} {} -> {}", key.fact(), key.column(), max);
        }
        return Optional.ofNullable(max);
    }

    private static int countWithin(List<LocalDate> dates, DateWindow window) {
        int n = 0;
        for (LocalDate d : dates) {
            if (window.contains(d)) n++;
        }
        return n;
    }

    private static int score(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        for (int i = 0; i < COLUMN_HINTS.length; i++) {
            if (lower.contains(COLUMN_HINTS[i])) {
                return COLUMN_HINTS.length - i;
            }
        }
        return 0;
    }
}
