package com.asiainfo.semantic;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.measure.MeasureDefinition;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.DimensionTable;
import com.asiainfo.semantic.core.model.FactTable;
import com.asiainfo.semantic.core.model.ForeignKey;
import com.asiainfo.semantic.core.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 测试用模型
 * support(): 与 model/csat-model.json 内容一致的客服满意度模型（FactCsat + FactTask）
 * survey(): 下钻用的单事实表模型，行数据由测试自行生成
 */
public final class TestModels {

    public static final String CSAT_RESPONSE = "# CSAT Response";
    public static final String DSAT = "# DSAT(1,2)";
    public static final String DSAT_RATE = "% DSAT(1,2)";

    private TestModels() {}

    public static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    public static SchemaRegistry supportSchema() {
        return SchemaRegistry.builder()
                .dimension(new DimensionTable("DimGeography", List.of(
                        ColumnDef.key("GeographyKey"),
                        ColumnDef.of("Country", ColumnType.TEXT),
                        ColumnDef.of("Region", ColumnType.TEXT)), "GeographyKey"))
                .dimension(new DimensionTable("DimProduct", List.of(
                        ColumnDef.key("ProductKey"),
                        ColumnDef.of("ProductName", ColumnType.TEXT),
                        ColumnDef.of("Family", ColumnType.TEXT)), "ProductKey"))
                .dimension(new DimensionTable("DimQueue", List.of(
                        ColumnDef.key("QueueKey"),
                        new ColumnDef("QueueID", ColumnType.TEXT, false, true),
                        ColumnDef.of("QueueName", ColumnType.TEXT)), "QueueKey"))
                .dimension(new DimensionTable("DimDate", List.of(
                        ColumnDef.key("DateKey"),
                        new ColumnDef("Date", ColumnType.DATE, false, true),
                        ColumnDef.of("Month", ColumnType.TEXT)), "DateKey"))
                .fact(new FactTable("FactCsat", List.of(
                        new ColumnDef("SurveyId", ColumnType.KEY, false, true),
                        ColumnDef.of("GeographyKey", ColumnType.KEY),
                        ColumnDef.of("ProductKey", ColumnType.KEY),
                        ColumnDef.of("QueueKey", ColumnType.KEY),
                        ColumnDef.of("SurveyDate", ColumnType.DATE),
                        ColumnDef.of("CsatScore", ColumnType.NUMERIC)),
                        List.of(
                                ForeignKey.of("GeographyKey", "DimGeography", "GeographyKey"),
                                ForeignKey.of("ProductKey", "DimProduct", "ProductKey"),
                                ForeignKey.of("QueueKey", "DimQueue", "QueueKey")),
                        ColumnRef.of("FactCsat", "SurveyDate")))
                .fact(new FactTable("FactTask", List.of(
                        new ColumnDef("TaskId", ColumnType.KEY, false, true),
                        ColumnDef.of("QueueKey", ColumnType.KEY),
                        ColumnDef.of("QueueID", ColumnType.TEXT),
                        ColumnDef.of("CreatedDateKey", ColumnType.KEY),
                        ColumnDef.of("ClosedDate", ColumnType.DATE),
                        ColumnDef.of("HandleMinutes", ColumnType.NUMERIC)),
                        List.of(
                                new ForeignKey("QueueKey", "DimQueue", "QueueKey", "Task-QueueKey", true),
                                new ForeignKey("QueueID", "DimQueue", "QueueID", "Task-QueueID", false),
                                new ForeignKey("CreatedDateKey", "DimDate", "DateKey", "Task-CreatedDate", true)),
                        ColumnRef.of("DimDate", "Date")))
                .build();
    }

    public static List<MeasureDefinition> supportMeasures() {
        return List.of(
                MeasureDefinition.of(CSAT_RESPONSE, "COUNT(FactCsat[CsatScore])"),
                MeasureDefinition.of(DSAT, "FILTERED([# CSAT Response], FactCsat[CsatScore] <= 2)"),
                MeasureDefinition.of(DSAT_RATE, "DIVIDE([# DSAT(1,2)], [# CSAT Response])"),
                MeasureDefinition.of("# CSAT(4,5)", "FILTERED([# CSAT Response], FactCsat[CsatScore] IN {4, 5})"),
                MeasureDefinition.of("% CSAT(4,5)", "[# CSAT(4,5)] / [# CSAT Response]"),
                MeasureDefinition.of("NSAT", "([% CSAT(4,5)] - [% DSAT(1,2)]) * 100 + 100"),
                MeasureDefinition.of("Avg CSAT", "AVERAGE(FactCsat[CsatScore])"),
                MeasureDefinition.of("# CSAT Response L7D", "LASTNDAYS([# CSAT Response], FactCsat[SurveyDate], 7)"),
                MeasureDefinition.of("% DSAT(1,2) L30D", "LASTNDAYS([% DSAT(1,2)], FactCsat[SurveyDate], 30)"),
                MeasureDefinition.of("# Tasks", "COUNTROWS(FactTask)"),
                MeasureDefinition.of("Avg Handle Time", "AVERAGE(FactTask[HandleMinutes])"),
                MeasureDefinition.of("P75 Handle Time", "PERCENTILE(FactTask[HandleMinutes], 0.75)"),
                MeasureDefinition.of("# Tasks L3D", "LASTNDAYS([# Tasks], DimDate[Date], 3)"),
                MeasureDefinition.of("# Tasks Closed L7D", "LASTNDAYS([# Tasks], FactTask[ClosedDate], 7)"),
                MeasureDefinition.of("# Billing Tasks (Routed)",
                        "FILTERED([# Tasks], DimQueue[QueueName] = \"Billing\", "
                                + "USERELATIONSHIP(FactTask[QueueID], DimQueue[QueueID]))"));
    }

    /**
     * 只含表结构与行数据，度量由调用方添加
     */
    public static SemanticModel.Builder supportBuilder() {
        return SemanticModel.builder()
                .name("csat-support")
                .schema(supportSchema())
                .rows("DimGeography", List.of(
                        row(1, "US", "Americas"),
                        row(2, "CA", "Americas"),
                        row(3, "DE", "EMEA"),
                        row(4, "JP", "APAC")))
                .rows("DimProduct", List.of(
                        row(10, "Outlook", "Office"),
                        row(20, "Teams", "Office"),
                        row(30, "Azure", "Cloud")))
                .rows("DimQueue", List.of(
                        row(100, "Q-BILL", "Billing"),
                        row(200, "Q-TECH", "Technical"),
                        row(300, "Q-ACCT", "Account")))
                .rows("DimDate", dimDateRows())
                .rows("FactCsat", List.of(
                        row(1, 1, 10, 100, "2025-10-01", 1),
                        row(2, 1, 20, 100, "2025-10-02", 1),
                        row(3, 2, 10, 200, "2025-10-03", 2),
                        row(4, 3, 30, 200, "2025-10-05", 4),
                        row(5, 3, 20, 300, "2025-10-08", 5),
                        row(6, 4, 30, 300, "2025-10-12", 5),
                        row(7, 1, 10, 100, "2025-10-20", 5),
                        row(8, null, 20, 200, "2025-10-25", 3),
                        row(9, 9, 10, 100, "2025-10-28", 2),
                        row(10, 2, 30, 300, "2025-10-31", 4)))
                .rows("FactTask", List.of(
                        row(1, 100, "Q-BILL", 20251001, null, 10),
                        row(2, 100, "Q-TECH", 20251002, null, 20),
                        row(3, 200, "Q-TECH", 20251003, null, 30),
                        row(4, 200, "Q-TECH", 20251004, null, 40),
                        row(5, 300, "Q-ACCT", 20251005, null, 50),
                        row(6, 300, null, 20251006, null, 60),
                        row(7, 400, "Q-ACCT", 20251007, null, 70),
                        row(8, null, "Q-BILL", 20251008, null, 80)));
    }

    public static SemanticModel support(MeasureDefinition... extra) {
        SemanticModel.Builder builder = supportBuilder().measures(supportMeasures());
        for (MeasureDefinition def : extra) {
            builder.measure(def);
        }
        return builder.build();
    }

    private static List<List<Object>> dimDateRows() {
        List<List<Object>> rows = new ArrayList<>();
        for (int day = 1; day <= 10; day++) {
            rows.add(row(20251000 + day, String.format("2025-10-%02d", day), "2025-10"));
        }
        return rows;
    }

    // ==================== 下钻模型 ====================

    public static SchemaRegistry surveySchema() {
        return SchemaRegistry.builder()
                .fact(new FactTable("FactSurvey", List.of(
                        new ColumnDef("Id", ColumnType.KEY, false, true),
                        ColumnDef.of("Region", ColumnType.TEXT),
                        ColumnDef.of("Channel", ColumnType.TEXT),
                        ColumnDef.of("Score", ColumnType.NUMERIC)),
                        List.of(), null))
                .build();
    }

    /**
     * 生成问卷行：每个分区 size 行，前 bad 行为差评（1 分），其余为 5 分；渠道按行号奇偶交替
     */
    public static final class SurveyRows {
        private final List<List<Object>> rows = new ArrayList<>();

        public SurveyRows region(String region, int size, int bad) {
            for (int i = 0; i < size; i++) {
                rows.add(row(rows.size() + 1, region, i % 2 == 0 ? "Web" : "Phone", i < bad ? 1 : 5));
            }
            return this;
        }

        public List<List<Object>> build() {
            return rows;
        }
    }

    public static SemanticModel survey(List<List<Object>> rows) {
        return SemanticModel.builder()
                .name("survey")
                .schema(surveySchema())
                .rows("FactSurvey", rows)
                .measure(MeasureDefinition.of("# Resp", "COUNTROWS(FactSurvey)"))
                .measure(MeasureDefinition.of("# Bad", "FILTERED([# Resp], FactSurvey[Score] <= 2)"))
                .measure(MeasureDefinition.of("% Bad", "DIVIDE([# Bad], [# Resp])"))
                .build();
    }
}
