package com.asiainfo.semantic.core.exception;

/**
 * 锚点日期不可用：锚点列全部为空，或事实表没有可用的日期列。
 * 可恢复错误，调用方应改用自己的固定时间窗口。
 */
public class NoAnchorException extends SemanticModelException {

    private final String factTable;
    private final String anchorColumn;

    public NoAnchorException(String factTable, String anchorColumn) {
        super(String.format("No anchor date for %s: column %s has no non-null value", factTable, anchorColumn));
        this.factTable = factTable;
        this.anchorColumn = anchorColumn;
    }

    public String getFactTable() {
        return factTable;
    }

    public String getAnchorColumn() {
        return anchorColumn;
    }

    @Override
    public String getUserFriendlyMessage() {
        return String.format("事实表 %s 的锚点列 %s 没有有效日期", factTable, anchorColumn);
    }
}
