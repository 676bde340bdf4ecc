package org.nowstart.pairsim.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.pairsim.data.dto.AggregationResult;
import org.nowstart.pairsim.data.dto.BacktestReport;
import org.nowstart.pairsim.data.dto.EquityPoint;
import org.nowstart.pairsim.data.dto.EquityTableRow;
import org.nowstart.pairsim.data.dto.SimulationResult;
import org.nowstart.pairsim.data.dto.TradeRecord;
import org.nowstart.pairsim.data.dto.VariantSummary;
import org.nowstart.pairsim.data.type.CloseReason;
import org.nowstart.pairsim.data.type.Direction;
import org.nowstart.pairsim.data.type.SimulationMode;

class ReportExportServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 2);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final ReportExportService service = new ReportExportService(objectMapper);

    @Test
    void export_writesEquityTableTradesAndSummary() throws IOException {
        SimulationResult result = new SimulationResult(
                "Ridge",
                10_000.0,
                10_004.0,
                List.of(new EquityPoint(DAY, 10_004.0, 0)),
                List.of(
                        TradeRecord.entry(DAY, "P1", Direction.LONG, 200.0, 100.0, 0.0),
                        TradeRecord.exit(DAY, "P1", Direction.LONG, 200.0, 102.0, 4.0, CloseReason.MEAN_REVERSION)
                ),
                0,
                0.0
        );
        Map<String, SimulationResult> results = new LinkedHashMap<>();
        results.put("Ridge", result);
        AggregationResult aggregation = new AggregationResult(
                List.of(new EquityTableRow(DAY, Map.of("Ridge", 10_004.0), Map.of("Ridge", 0))),
                results,
                List.of(VariantSummary.of(result))
        );
        BacktestReport report = new BacktestReport(SimulationMode.SPREAD_PRICE, DAY, DAY, aggregation.summaries(), List.of(), List.of());
        Path outputDir = tempDir.resolve("out");

        List<Path> written = service.export(outputDir, aggregation, report);

        assertThat(written).hasSize(3);
        assertThat(Files.readAllLines(outputDir.resolve(ReportExportService.EQUITY_TABLE_FILE)))
                .containsExactly("date,equity_Ridge,positions_Ridge", "2024-01-02,10004.000000,0");

        List<String> trades = Files.readAllLines(outputDir.resolve("trades_Ridge.csv"));
        assertThat(trades).hasSize(3);
        assertThat(trades.get(1)).startsWith("2024-01-02,P1,ENTRY,LONG,200.000000,100.000000,0.000000,,,");
        assertThat(trades.get(2)).endsWith(",4.000000,2.000000,MEAN_REVERSION");

        JsonNode summary = objectMapper.readTree(outputDir.resolve(ReportExportService.SUMMARY_FILE).toFile());
        assertThat(summary.get("mode").asText()).isEqualTo("SPREAD_PRICE");
        assertThat(summary.get("fromDate").asText()).isEqualTo("2024-01-02");
        assertThat(summary.get("summaries").get(0).get("finalEquity").asDouble()).isEqualTo(10_004.0);
    }
}
