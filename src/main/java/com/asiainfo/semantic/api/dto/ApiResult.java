package com.asiainfo.semantic.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 统一返回结构
 */
@RegisterForReflection
public record ApiResult(
    List<?> dataArray, // 数据数组
    String status,     // 业务状态码 0000 成功 / 9999 失败
    String msg         // 如 查询成功！返回 xx 条记录
) {
    public static final String SUCCESS = "0000";
    public static final String FAILURE = "9999";

    public static ApiResult success(List<?> dataArray, String msg) {
        return new ApiResult(dataArray, SUCCESS, msg);
    }

    public static ApiResult error(String errorMsg) {
        return new ApiResult(List.of(), FAILURE, errorMsg);
    }
}
