package org.nowstart.pairsim.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.AggregationResult;
import org.nowstart.pairsim.data.dto.BacktestReport;
import org.nowstart.pairsim.data.dto.EquityTableRow;
import org.nowstart.pairsim.data.dto.SimulationResult;
import org.nowstart.pairsim.data.dto.TradeRecord;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReportExportService {

    static final String EQUITY_TABLE_FILE = "equity_table.csv";
    static final String SUMMARY_FILE = "summary.json";
    private static final String TRADES_HEADER = "date,pair_id,event,direction,invested_capital,price,cost,realized_pnl,pnl_pct,close_reason";

    private final ObjectMapper objectMapper;

    public List<Path> export(Path outputDir, AggregationResult aggregation, BacktestReport report) {
        try {
            Files.createDirectories(outputDir);

            List<Path> written = new ArrayList<>();
            written.add(writeLines(outputDir.resolve(EQUITY_TABLE_FILE), equityTableLines(aggregation)));
            for (SimulationResult result : aggregation.results().values()) {
                Path tradesPath = outputDir.resolve("trades_" + safeName(result.variant()) + ".csv");
                written.add(writeLines(tradesPath, tradeLines(result.trades())));
            }

            Path summaryPath = outputDir.resolve(SUMMARY_FILE);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryPath.toFile(), report);
            written.add(summaryPath);

            log.info("event=report_exported dir={} files={}", outputDir.toAbsolutePath(), written.size());
            return List.copyOf(written);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to export report: " + outputDir, e);
        }
    }

    private List<String> equityTableLines(AggregationResult aggregation) {
        List<String> variants = new ArrayList<>(aggregation.results().keySet());
        List<String> lines = new ArrayList<>(aggregation.equityTable().size() + 1);

        StringBuilder header = new StringBuilder("date");
        for (String variant : variants) {
            header.append(",equity_").append(safeName(variant));
        }
        for (String variant : variants) {
            header.append(",positions_").append(safeName(variant));
        }
        lines.add(header.toString());

        for (EquityTableRow row : aggregation.equityTable()) {
            StringBuilder line = new StringBuilder(row.date().toString());
            for (String variant : variants) {
                Double equity = row.equityByVariant().get(variant);
                line.append(',').append(equity == null ? "" : format(equity));
            }
            for (String variant : variants) {
                Integer positions = row.openPositionsByVariant().get(variant);
                line.append(',').append(positions == null ? "" : positions.toString());
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private List<String> tradeLines(List<TradeRecord> trades) {
        List<String> lines = new ArrayList<>(trades.size() + 1);
        lines.add(TRADES_HEADER);
        for (TradeRecord trade : trades) {
            lines.add(trade.date()
                    + "," + trade.pairId()
                    + "," + trade.eventType()
                    + "," + trade.direction()
                    + "," + format(trade.investedCapital())
                    + "," + format(trade.price())
                    + "," + format(trade.cost())
                    + "," + format(trade.realizedPnl())
                    + "," + format(trade.pnlPct())
                    + "," + (trade.closeReason() == null ? "" : trade.closeReason().name()));
        }
        return lines;
    }

    private Path writeLines(Path path, List<String> lines) throws IOException {
        Files.write(path, lines, StandardCharsets.UTF_8);
        return path;
    }

    private String format(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        return String.format(Locale.US, "%.6f", value);
    }

    private String safeName(String variant) {
        return variant.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
