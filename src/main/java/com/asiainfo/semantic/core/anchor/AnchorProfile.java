package com.asiainfo.semantic.core.anchor;

import com.asiainfo.semantic.core.model.ColumnRef;

import java.time.LocalDate;

/**
 * 锚点日期列画像
 *
 * @param nonBlank 日期非空的事实行数
 * @param last7    落在 [anchor - 7, anchor] 内的行数，其余同理
 */
public record AnchorProfile(
    String fact,
    ColumnRef column,
    int totalRows,
    int nonBlank,
    LocalDate min,
    LocalDate max,
    LocalDate anchor,
    int last7,
    int last30,
    int last90
) {}
