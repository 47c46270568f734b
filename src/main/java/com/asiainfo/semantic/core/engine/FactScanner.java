package com.asiainfo.semantic.core.engine;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.filter.ColumnPredicate;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.filter.Predicates;
import com.asiainfo.semantic.core.model.ColumnRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * 事实表行扫描
 * 上下文中的谓词按可达性分三类：
 * 事实表自身的列直接比较；可经外键到达的维度列先关联再比较（空外键与孤儿行视为 null）；
 * 其他事实表或不可达表上的谓词对本表不生效。
 */
final class FactScanner {

    private static final Logger log = LoggerFactory.getLogger(FactScanner.class);

    private static final int CHECK_INTERVAL = 4096;

    private FactScanner() {}

    static BitSet scan(SemanticModel model, String fact, FilterContext context, CancellationToken token) {
        int rowCount = model.rowCount(fact);
        BitSet result = new BitSet(rowCount);

        List<RowAccessor> accessors = new ArrayList<>();
        List<ColumnPredicate> predicates = new ArrayList<>();
        for (Map.Entry<ColumnRef, ColumnPredicate> e : context.predicates().entrySet()) {
            ColumnRef column = e.getKey();
            ColumnPredicate predicate = e.getValue();
            if (predicate instanceof Predicates.All) {
                continue;
            }
            if (!model.canReach(fact, column)) {
                log.trace("[Scan] {} does not reach {}, predicate ignored", fact, column);
                continue;
            }
            if (predicate.isUnsatisfiable()) {
                return result;
            }
            String selector = column.table().equals(fact)
                    ? null
                    : context.selectedRelationship(fact, column.table()).orElse(null);
            accessors.add(model.accessor(fact, column, selector));
            predicates.add(predicate);
        }

        int n = accessors.size();
        for (int row = 0; row < rowCount; row++) {
            if (row % CHECK_INTERVAL == 0) {
                token.throwIfCancelled();
            }
            boolean keep = true;
            for (int i = 0; i < n && keep; i++) {
                keep = predicates.get(i).test(accessors.get(i).get(row));
            }
            if (keep) {
                result.set(row);
            }
        }
        return result;
    }
}
