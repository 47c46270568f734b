package com.asiainfo.semantic.core.engine;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.measure.MeasureExpr;
import com.asiainfo.semantic.core.measure.MeasureRegistry;
import com.asiainfo.semantic.core.model.MeasureValue;

import java.util.BitSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单次查询的求值会话
 * 绑定一个模型快照与取消令牌，并在查询范围内缓存行扫描结果与度量值，
 * 相同 (度量, 上下文) 只计算一次。会话可被下钻的并行任务共享。
 */
public final class EvaluationSession {

    private final SemanticModel model;
    private final CancellationToken token;
    private final Map<ScanKey, BitSet> scans = new ConcurrentHashMap<>();
    private final Map<MemoKey, MeasureValue> memo = new ConcurrentHashMap<>();

    private record ScanKey(String fact, FilterContext context) {}

    private record MemoKey(String measure, FilterContext context) {}

    public EvaluationSession(SemanticModel model, CancellationToken token) {
        this.model = model;
        this.token = token;
    }

    /**
     * 满足上下文的事实行集合。返回的 BitSet 在会话内共享，调用方不得修改。
     */
    public BitSet rows(String fact, FilterContext context) {
        token.throwIfCancelled();
        ScanKey key = new ScanKey(fact, context);
        BitSet cached = scans.get(key);
        if (cached != null) {
            return cached;
        }
        BitSet rows = FactScanner.scan(model, fact, context, token);
        BitSet prev = scans.putIfAbsent(key, rows);
        return prev != null ? prev : rows;
    }

    public MeasureValue evaluate(MeasureExpr expr, FilterContext context) {
        token.throwIfCancelled();
        return expr.evaluate(this, context);
    }

    /**
     * 按名称求值已注册度量（带会话级缓存）
     */
    public MeasureValue evaluateMeasure(String measureName, FilterContext context) {
        MemoKey key = new MemoKey(measureName, context);
        MeasureValue cached = memo.get(key);
        if (cached != null) {
            return cached;
        }
        // 不使用 computeIfAbsent：求值过程会递归写入同一个 map
        MeasureValue value = evaluate(model.measures().require(measureName).expr(), context);
        memo.putIfAbsent(key, value);
        return value;
    }

    public SemanticModel model() {
        return model;
    }

    public MeasureRegistry measures() {
        return model.measures();
    }

    public CancellationToken token() {
        return token;
    }

    int cachedScans() {
        return scans.size();
    }
}
