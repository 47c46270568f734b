package com.asiainfo.semantic.api;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * ModelAdminResource 集成测试
 */
@QuarkusTest
class ModelAdminResourceTest {

    @Test
    void testSummary() {
        given()
                .when()
                .get("/api/v1/model/summary")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray[0].name", equalTo("csat-support"))
                .body("dataArray[0].measures", equalTo(15))
                .body("dataArray[0].ambiguousPairs", hasItem("FactTask -> DimQueue"));
    }

    @Test
    void testLint() {
        given()
                .when()
                .get("/api/v1/model/lint")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray", hasSize(1))
                .body("dataArray[0].code", equalTo("DUAL_KEY"));
    }

    @Test
    void testReload() {
        given()
                .when()
                .post("/api/v1/model/reload")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("msg", startsWith("加载成功"));
    }

    @Test
    void testReloadFailureKeepsServing() {
        given()
                .queryParam("location", "classpath:model/missing.json")
                .when()
                .post("/api/v1/model/reload")
                .then()
                .statusCode(200)
                .body("status", equalTo("9999"))
                .body("msg", containsString("模型定义错误"));

        given()
                .when()
                .get("/api/v1/model/summary")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("dataArray[0].name", equalTo("csat-support"));
    }
}
