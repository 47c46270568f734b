package com.asiainfo.semantic.api;

import com.asiainfo.semantic.api.dto.ApiResult;
import com.asiainfo.semantic.application.ModelSummary;
import com.asiainfo.semantic.application.SemanticModelService;
import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.SemanticModelException;
import com.asiainfo.semantic.core.integrity.LintWarning;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 模型管理 API：重新加载、概要、静态检查
 */
@ApplicationScoped
@Path("/api/v1/model")
@Produces(MediaType.APPLICATION_JSON)
public class ModelAdminResource {

    private static final Logger log = LoggerFactory.getLogger(ModelAdminResource.class);

    @Inject
    SemanticModelService service;

    /**
     * 重新加载模型，成功后原子替换快照；失败时旧快照继续服务
     *
     * @param location 模型文档位置，为空时使用配置值
     */
    @POST
    @Path("/reload")
    public ApiResult reload(@QueryParam("location") String location) {
        try {
            SemanticModel model = location == null || location.isBlank()
                    ? service.reload()
                    : service.reload(location);
            return ApiResult.success(List.of(service.summary()), "加载成功！ version=" + model.version());
        } catch (SemanticModelException e) {
            log.error("[Model] 模型加载失败: {}", e.getMessage());
            return ApiResult.error(e.getUserFriendlyMessage());
        } catch (Exception e) {
            log.error("[Model] 模型加载失败", e);
            return ApiResult.error("加载失败: " + e.getMessage());
        }
    }

    @GET
    @Path("/summary")
    public ApiResult summary() {
        try {
            ModelSummary summary = service.summary();
            return ApiResult.success(List.of(summary), "查询成功！");
        } catch (SemanticModelException e) {
            return ApiResult.error(e.getUserFriendlyMessage());
        }
    }

    @GET
    @Path("/lint")
    public ApiResult lint() {
        try {
            List<LintWarning> warnings = service.lint();
            return ApiResult.success(warnings, "检查完成！ " + warnings.size() + " 条提示");
        } catch (SemanticModelException e) {
            return ApiResult.error(e.getUserFriendlyMessage());
        }
    }
}
