package com.asiainfo.semantic.api;

import com.asiainfo.semantic.api.dto.ApiResult;
import com.asiainfo.semantic.api.dto.DrillApiRequest;
import com.asiainfo.semantic.api.dto.EvaluateRequest;
import com.asiainfo.semantic.api.dto.FilterCondition;
import com.asiainfo.semantic.api.dto.FilterContextMapper;
import com.asiainfo.semantic.application.SemanticModelService;
import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.anchor.AnchorProfile;
import com.asiainfo.semantic.core.drill.DeviationMode;
import com.asiainfo.semantic.core.drill.Direction;
import com.asiainfo.semantic.core.drill.DrillRequest;
import com.asiainfo.semantic.core.drill.DrillResult;
import com.asiainfo.semantic.core.exception.SemanticModelException;
import com.asiainfo.semantic.core.filter.FilterContext;
import com.asiainfo.semantic.core.integrity.IntegrityReport;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.MeasureValue;
import com.asiainfo.semantic.core.model.ResultTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 语义模型查询 REST API
 * 业务错误统一以 status=9999 返回，HTTP 状态码始终为 200。
 */
@ApplicationScoped
@Path("/api/v1/semantic")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SemanticQueryResource {

    private static final Logger log = LoggerFactory.getLogger(SemanticQueryResource.class);

    @Inject
    SemanticModelService service;

    /**
     * 单值求值，dataArray 只有一行：{measure: value}，无数据时 value 为 null
     */
    @POST
    @Path("/evaluate")
    public ApiResult evaluate(EvaluateRequest request) {
        return handle("evaluate", request, () -> {
            FilterContext context = context(request.filters(), request.relationships());
            MeasureValue value = service.evaluate(request.measure(), context);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(request.measure(), value.toNullable());
            return ApiResult.success(List.of(row), value.isPresent() ? "查询成功！" : "查询成功！无数据");
        });
    }

    /**
     * 分组求值，列顺序与请求一致，最后一列为度量值
     */
    @POST
    @Path("/evaluateGrouped")
    public ApiResult evaluateGrouped(EvaluateRequest request) {
        return handle("evaluateGrouped", request, () -> {
            FilterContext context = context(request.filters(), request.relationships());
            List<ColumnRef> groupBy = FilterContextMapper.columnRefs(request.groupBy());
            ResultTable table = service.evaluateGrouped(request.measure(), groupBy, context);
            return ApiResult.success(table.toMaps(), "查询成功！ 返回 " + table.size() + " 条记录");
        });
    }

    @POST
    @Path("/drill")
    public ApiResult drill(DrillApiRequest request) {
        return handle("drill", request, () -> {
            DrillRequest.Builder builder = service.drillDefaults(request.measure())
                    .baseline(context(request.filters(), request.relationships()))
                    .path(FilterContextMapper.columnRefs(request.path()));
            if (request.coverageThreshold() != null) builder.coverageThreshold(request.coverageThreshold());
            if (request.minSample() != null) builder.minSample(request.minSample());
            if (request.marginalThreshold() != null) builder.marginalThreshold(request.marginalThreshold());
            if (request.goal() != null) builder.goal(request.goal());
            if (request.direction() != null) {
                builder.direction(Direction.valueOf(request.direction().toUpperCase(Locale.ROOT)));
            }
            if (request.mode() != null) {
                builder.mode(DeviationMode.valueOf(request.mode().toUpperCase(Locale.ROOT)));
            }
            if (request.sampleMeasure() != null) builder.sampleMeasure(request.sampleMeasure());
            if (request.fallbacks() != null) {
                request.fallbacks().forEach((col, alternates) -> builder.fallback(
                        FilterContextMapper.columnRef(col),
                        FilterContextMapper.columnRefs(alternates).toArray(new ColumnRef[0])));
            }
            DrillResult result = service.drill(builder.build());
            return ApiResult.success(List.of(result),
                    String.format("下钻完成！ %d 步, %s", result.depth(), result.termination()));
        });
    }

    @GET
    @Path("/integrity/{fact}")
    public ApiResult integrity(@PathParam("fact") String fact) {
        return handle("integrity", fact, () -> {
            List<IntegrityReport> reports = service.checkIntegrity(fact);
            return ApiResult.success(reports, "检查完成！ " + reports.size() + " 条关系");
        });
    }

    @GET
    @Path("/anchor/{fact}")
    public ApiResult anchor(@PathParam("fact") String fact) {
        return handle("anchor", fact, () -> {
            AnchorProfile profile = service.anchorProfile(fact);
            return ApiResult.success(List.of(profile), profile.anchor() == null ? "锚点列全部为空" : "查询成功！");
        });
    }

    @GET
    @Path("/measures")
    public ApiResult measures() {
        return handle("measures", null, () -> {
            var catalog = service.catalog();
            return ApiResult.success(catalog, "查询成功！ 共 " + catalog.size() + " 个度量");
        });
    }

    private FilterContext context(List<FilterCondition> filters, List<String> relationships) {
        SemanticModel model = service.model();
        return FilterContextMapper.toContext(model, filters, relationships);
    }

    private ApiResult handle(String operation, Object request, Supplier<ApiResult> action) {
        try {
            log.info("收到{}请求:{}", operation, request);
            return action.get();
        } catch (SemanticModelException e) {
            log.warn("[API] {} failed: {}", operation, e.getMessage());
            return ApiResult.error(e.getUserFriendlyMessage());
        } catch (Exception e) {
            log.error("[API] {} failed", operation, e);
            return ApiResult.error("查询失败: " + e.getMessage());
        }
    }
}
