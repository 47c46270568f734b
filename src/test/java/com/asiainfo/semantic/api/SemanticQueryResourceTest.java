package com.asiainfo.semantic.api;

import com.asiainfo.semantic.api.dto.DrillApiRequest;
import com.asiainfo.semantic.api.dto.EvaluateRequest;
import com.asiainfo.semantic.api.dto.FilterCondition;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 语义查询 API 集成测试
 * 请求 -> 筛选上下文 -> 缓存 -> 求值 -> 统一返回结构
 */
@QuarkusTest
@DisplayName("Semantic Query API Integration Tests")
class SemanticQueryResourceTest {

    private static Response post(String path, Object body) {
        return given()
                .contentType(ContentType.JSON)
                .body(body)
                .when()
                .post("/api/v1/semantic" + path);
    }

    @Test
    @DisplayName("Should evaluate a ratio measure over the whole model")
    void testEvaluate() {
        Response response = post("/evaluate", new EvaluateRequest("% DSAT(1,2)", null, null, null));

        response.then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray", hasSize(1));
        Map<String, Object> row = response.jsonPath().getMap("dataArray[0]");
        assertEquals(0.4, ((Number) row.get("% DSAT(1,2)")).doubleValue(), 1e-9);
    }

    @Test
    @DisplayName("Should apply dimension filters")
    void testEvaluateWithFilter() {
        EvaluateRequest request = new EvaluateRequest("# DSAT(1,2)", null,
                List.of(new FilterCondition("DimGeography[Region]", "EQ", List.of("Americas"))), null);

        Response response = post("/evaluate", request);

        response.then().statusCode(200).body("status", equalTo("0000"));
        Map<String, Object> row = response.jsonPath().getMap("dataArray[0]");
        assertEquals(3, ((Number) row.get("# DSAT(1,2)")).intValue());
    }

    @Test
    @DisplayName("Should return null value when the context has no data")
    void testEvaluateNoValue() {
        EvaluateRequest request = new EvaluateRequest("% DSAT(1,2)", null,
                List.of(new FilterCondition("DimGeography[Region]", "EQ", List.of("Nowhere"))), null);

        Response response = post("/evaluate", request);

        response.then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("msg", equalTo("查询成功！无数据"));
        Map<String, Object> row = response.jsonPath().getMap("dataArray[0]");
        assertTrue(row.containsKey("% DSAT(1,2)"));
        assertNull(row.get("% DSAT(1,2)"));
    }

    @Test
    @DisplayName("Should report unknown measure as business error")
    void testUnknownMeasure() {
        post("/evaluate", new EvaluateRequest("# Nothing", null, null, null))
                .then()
                .statusCode(200)
                .body("status", equalTo("9999"))
                .body("msg", containsString("度量不存在"))
                .body("dataArray", empty());
    }

    @Test
    @DisplayName("Should reject unknown filter column")
    void testUnknownFilterColumn() {
        EvaluateRequest request = new EvaluateRequest("# Tasks", null,
                List.of(new FilterCondition("DimQueue[Nope]", "EQ", List.of("x"))), null);

        post("/evaluate", request)
                .then()
                .statusCode(200)
                .body("status", equalTo("9999"));
    }

    @Test
    @DisplayName("Should require explicit relationship for ambiguous join")
    void testAmbiguousGrouping() {
        post("/evaluateGrouped", new EvaluateRequest("# Tasks", List.of("DimQueue[QueueName]"), null, null))
                .then()
                .statusCode(200)
                .body("status", equalTo("9999"))
                .body("msg", containsString("多条关联路径"));

        post("/evaluateGrouped", new EvaluateRequest("# Tasks", List.of("DimQueue[QueueName]"), null,
                List.of("Task-QueueID")))
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray", hasSize(4))
                .body("dataArray[0].'DimQueue[QueueName]'", equalTo("Account"));
    }

    @Test
    @DisplayName("Should drill into the region explaining the deviation")
    void testDrill() {
        DrillApiRequest request = new DrillApiRequest("% DSAT(1,2)", null, null,
                List.of("DimGeography[Region]"), null, 1, null, 0.1, "higher_is_worse", "rate", null, null);

        post("/drill", request)
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray[0].termination", equalTo("COVERAGE_REACHED"))
                .body("dataArray[0].steps", hasSize(1))
                .body("dataArray[0].steps[0].values[0]", equalTo("Americas"))
                .body("dataArray[0].steps[0].column", equalTo("DimGeography[Region]"));
    }

    @Test
    @DisplayName("Should return integrity reports for every relationship of a fact")
    void testIntegrity() {
        given()
                .when()
                .get("/api/v1/semantic/integrity/FactCsat")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray", hasSize(3))
                .body("dataArray[0].severity", equalTo("RED"))
                .body("dataArray[0].orphanCount", equalTo(1));

        given()
                .when()
                .get("/api/v1/semantic/integrity/FactMissing")
                .then()
                .statusCode(200)
                .body("status", equalTo("9999"));
    }

    @Test
    @DisplayName("Should expose the anchor date profile")
    void testAnchor() {
        given()
                .when()
                .get("/api/v1/semantic/anchor/FactCsat")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray[0].anchor", equalTo("2025-10-31"))
                .body("dataArray[0].last7", equalTo(3));
    }

    @Test
    @DisplayName("Should list the measure catalog")
    void testMeasures() {
        given()
                .when()
                .get("/api/v1/semantic/measures")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray", hasSize(15))
                .body("dataArray.name", hasItem("NSAT"));
    }
}
