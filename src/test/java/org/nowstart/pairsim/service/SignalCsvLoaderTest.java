package org.nowstart.pairsim.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.pairsim.BacktestFixtures;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.exception.SignalValidationException;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.SimulationMode;

class SignalCsvLoaderTest {

    @TempDir
    Path tempDir;

    private final SignalCsvLoader loader = new SignalCsvLoader();
    private final BacktestProperties priceProperties = BacktestFixtures.properties().build();

    @Test
    void load_parsesRowsAndSortsByDate() throws IOException {
        Path csv = write(
                "\uFEFFDate,Pair_ID,Z_Score,Spread,Ridge_Pred",
                "2024-01-03 00:00:00,KO_PEP,0.4,101.5,0.5",
                "2024-01-02,KO_PEP,-2.1,100.0,0.91",
                "2024-01-02,XOM_CVX,nan,,0.2"
        );

        List<SignalRow> rows = loader.load(csv, priceProperties);

        assertThat(rows).extracting(SignalRow::date)
                .containsExactly(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3));
        assertThat(rows.get(0).pairId()).isEqualTo("KO_PEP");
        assertThat(rows.get(0).zScore()).isEqualTo(-2.1);
        assertThat(rows.get(0).prediction("Ridge_Pred")).isEqualTo(0.91);
        assertThat(rows.get(1).hasZScore()).isFalse();
        assertThat(rows.get(1).hasSpreadPrice()).isFalse();
        assertThat(rows.get(2).targetDirection()).isEqualTo(SignalRow.UNKNOWN_DIRECTION);
    }

    @Test
    void load_usesFirstColumnAndDefaultPairWhenHeadersAbsent() throws IOException {
        Path csv = write(
                ",Z_Score,Spread,Ridge_Pred",
                "2024-01-02,-2.0,10.0,0.9"
        );

        List<SignalRow> rows = loader.load(csv, priceProperties);

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.date()).isEqualTo(LocalDate.of(2024, 1, 2));
            assertThat(row.pairId()).isEqualTo(SignalCsvLoader.DEFAULT_PAIR_ID);
        });
    }

    @Test
    void load_outcomeModeReadsTargets() throws IOException {
        Path csv = write(
                "Date,Z_Score,Ridge_Pred,Target_Return,Target_Direction",
                "2024-01-02,2.0,0.1,-0.05,0",
                "2024-01-03,2.0,0.1,,"
        );
        BacktestProperties properties = BacktestFixtures.properties().mode(SimulationMode.TARGET_OUTCOME).build();

        List<SignalRow> rows = loader.load(csv, properties);

        assertThat(rows.get(0).targetReturn()).isEqualTo(-0.05);
        assertThat(rows.get(0).targetDirection()).isZero();
        assertThat(rows.get(0).hasTargetOutcome()).isTrue();
        assertThat(rows.get(1).hasTargetOutcome()).isFalse();
    }

    @Test
    void load_rejectsMissingRequiredColumn() throws IOException {
        Path csv = write("Date,Z_Score,Ridge_Pred", "2024-01-02,-2.0,0.9");

        assertThatThrownBy(() -> loader.load(csv, priceProperties))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("missing_column");
                    assertThat(e.getField()).isEqualTo("Spread");
                });
    }

    @Test
    void load_rejectsUnparsableCells() throws IOException {
        Path badNumber = write("Date,Z_Score,Spread,Ridge_Pred", "2024-01-02,abc,10.0,0.9");
        Path badDate = write("Date,Z_Score,Spread,Ridge_Pred", "02/01/2024,1.0,10.0,0.9");
        Path badDirection = write("Date,Z_Score,Ridge_Pred,Target_Return,Target_Direction", "2024-01-02,1.0,0.9,0.01,2");
        BacktestProperties outcome = BacktestFixtures.properties().mode(SimulationMode.TARGET_OUTCOME).build();

        assertThatThrownBy(() -> loader.load(badNumber, priceProperties))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> assertThat(e.getField()).isEqualTo("Z_Score"));
        assertThatThrownBy(() -> loader.load(badDate, priceProperties))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> assertThat(e.getCode()).isEqualTo("unparsable_value"));
        assertThatThrownBy(() -> loader.load(badDirection, outcome))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> assertThat(e.getField()).isEqualTo("Target_Direction"));
    }

    @Test
    void load_rejectsShortRowAndEmptyFile() throws IOException {
        Path shortRow = write("Date,Z_Score,Spread,Ridge_Pred", "2024-01-02,1.0");
        Path empty = write();

        assertThatThrownBy(() -> loader.load(shortRow, priceProperties))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> assertThat(e.getCode()).isEqualTo("malformed_row"));
        assertThatThrownBy(() -> loader.load(empty, priceProperties))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> assertThat(e.getCode()).isEqualTo("empty_file"));
    }

    @Test
    void load_rejectsDuplicateHeaderName() throws IOException {
        Path csv = write("Date,Date,Z_Score,Spread,Ridge_Pred", "2024-01-02,2024-01-02,1.0,10.0");

        assertThatThrownBy(() -> loader.load(csv, priceProperties))
                .isInstanceOfSatisfying(SignalValidationException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("malformed_header");
                    assertThat(e.getField()).isEqualTo("Date");
                });
    }

    @Test
    void load_missingFileIsIllegalState() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.csv"), priceProperties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absent.csv");
    }

    private Path write(String... lines) throws IOException {
        Path path = Files.createTempFile(tempDir, "signals", ".csv");
        Files.write(path, List.of(lines), StandardCharsets.UTF_8);
        return path;
    }
}
