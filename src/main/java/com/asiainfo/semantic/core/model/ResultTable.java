package com.asiainfo.semantic.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分组查询结果：每行为 (分组列取值..., 度量值)，列顺序与请求一致
 */
public record ResultTable(
    List<String> groupColumns,
    String measure,
    List<Row> rows
) {
    public record Row(List<Object> keys, MeasureValue value) {}

    public ResultTable {
        groupColumns = List.copyOf(groupColumns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /**
     * 按分组键查找行，找不到返回 null
     */
    public Row find(Object... keys) {
        for (Row row : rows) {
            if (row.keys().size() != keys.length) continue;
            boolean match = true;
            for (int i = 0; i < keys.length && match; i++) {
                match = Values.sameValue(row.keys().get(i), keys[i]);
            }
            if (match) return row;
        }
        return null;
    }

    /**
     * 转换为 List<Map> 形式，便于接口直接返回
     */
    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < groupColumns.size(); i++) {
                map.put(groupColumns.get(i), row.keys().get(i));
            }
            map.put(measure, row.value().toNullable());
            result.add(map);
        }
        return result;
    }
}
