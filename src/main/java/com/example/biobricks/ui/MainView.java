package com.example.biobricks.ui;

import javafx.scene.layout.BorderPane;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.scene.control.*;
import javafx.scene.chart.PieChart;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.stage.FileChooser;
import javafx.stage.Window;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;

import java.io.*;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.biobricks.engine.*;
import com.example.biobricks.model.*;
import com.example.biobricks.services.*;
import com.example.biobricks.storage.JsonStorage;

public class MainView extends BorderPane {
    private static final Logger log = LoggerFactory.getLogger(MainView.class);

    // Same order as CompositionBreakdown palette indices
    private static final String[] PALETTE = {
        "#69f0ae", "#ffab40", "#448aff", "#ff4081", "#ffff00", "#18ffff", "#eeff41"
    };
    private static final String[] PROCESS_STEPS = {
        "Dehumidifying: removes moisture",
        "Grinding: uniform fine mix",
        "Molding: compact shaping",
        "Drying: set and harden bricks"
    };

    private final ConversionEngine engine;
    private final JsonStorage storage = new JsonStorage();
    private final CompositionBreakdown breakdown = new CompositionBreakdown();

    // Realtime analytics
    private final Label totalLabel = new Label();
    private final Label bricksLabel = new Label();
    private final Label volumeLabel = new Label();
    private final Label areaLabel = new Label();
    private final ProgressBar landfillBar = new ProgressBar(0);
    private final Label percentLabel = new Label();

    // Composition
    private final PieChart pie = new PieChart();
    private final GridPane valuesGrid = new GridPane();
    private final Map<String, TextField> valueFields = new LinkedHashMap<>();

    // Settings
    private final Map<Setting, TextField> settingFields = new EnumMap<>(Setting.class);

    private final Label status = new Label();

    public MainView(ConversionEngine engine) {
        this.engine = engine;
        setPadding(new Insets(8));

        VBox content = new VBox(10,
            sectionTitle("Realtime Analytics"),
            infoRow("Total available waste (kg)", totalLabel),
            infoRow("Bricks producible (count)", bricksLabel),
            infoRow("Volume diverted (m³)", volumeLabel),
            sectionTitle("Composition (edit and press Enter)"),
            buildComposition(),
            sectionTitle("Landfill reduction"),
            infoRow("Area reduced (m²)", areaLabel),
            landfillBar,
            percentLabel,
            sectionTitle("Brick & Landfill settings"),
            buildSettings(),
            sectionTitle("Process steps"),
            buildProcessSteps());
        content.setPadding(new Insets(12));
        landfillBar.setMaxWidth(Double.MAX_VALUE);

        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        setCenter(scroll);
        setBottom(status);
        BorderPane.setMargin(status, new Insets(4, 8, 0, 8));

        engine.subscribe(e -> refresh());
        refresh();
    }

    // ---------- COMPOSITION ----------
    private VBox buildComposition() {
        pie.setLegendVisible(false);
        pie.setLabelsVisible(true);
        pie.setPrefHeight(220);
        pie.setAnimated(false);

        valuesGrid.setHgap(8); valuesGrid.setVgap(6);
        int row = 0;
        for (String label : engine.labels()) {
            TextField tf = new TextField();
            tf.setPrefColumnCount(8);
            tf.setOnAction(e -> commitValue(label, tf));
            valueFields.put(label, tf);
            Label name = new Label(label);
            GridPane.setHgrow(name, Priority.ALWAYS);
            valuesGrid.addRow(row++, name, tf);
        }
        return new VBox(8, pie, valuesGrid);
    }

    private void commitValue(String label, TextField tf) {
        OptionalDouble v = NumberParsing.tryParse(tf.getText());
        if (v.isEmpty()) {
            showError(new IllegalArgumentException("Enter a valid number for " + label + "."));
            tf.setText(format(engine.valueOf(label)));
            return;
        }
        UpdateResult r = engine.updateValue(label, v.getAsDouble());
        tf.setText(format(engine.valueOf(label)));
        if (r == UpdateResult.CLAMPED) status.setText(label + " cannot be negative; set to 0.");
        else if (!r.applied()) showError(new IllegalArgumentException("Could not update " + label + ": " + r));
    }

    // ---------- SETTINGS ----------
    private GridPane buildSettings() {
        GridPane g = new GridPane();
        g.setHgap(12); g.setVgap(8);
        int i = 0;
        for (Setting s : Setting.values()) {
            TextField tf = new TextField();
            tf.setPrefColumnCount(10);
            tf.setOnAction(e -> commitSetting(s, tf));
            settingFields.put(s, tf);
            g.add(new VBox(4, new Label(s.displayName), tf), i % 2, i / 2);
            i++;
        }
        return g;
    }

    private void commitSetting(Setting s, TextField tf) {
        OptionalDouble v = NumberParsing.tryParse(tf.getText());
        UpdateResult r = v.isPresent() ? engine.updateSetting(s, v.getAsDouble()) : UpdateResult.REJECTED;
        tf.setText(format(engine.getSetting(s)));
        if (r != UpdateResult.UPDATED) showError(new IllegalArgumentException(s.displayName + " must be a number greater than 0."));
    }

    private VBox buildProcessSteps() {
        VBox box = new VBox(6);
        for (int i = 0; i < PROCESS_STEPS.length; i++) {
            Label n = new Label(String.valueOf(i + 1));
            n.setStyle("-fx-background-color: #64ffda; -fx-background-radius: 12; -fx-padding: 2 8 2 8;");
            HBox row = new HBox(10, n, new Label(PROCESS_STEPS[i]));
            row.setAlignment(Pos.CENTER_LEFT);
            box.getChildren().add(row);
        }
        return box;
    }

    // ---------- ACTIONS ----------
    public void loadSampleData() {
        try (InputStream in = getClass().getResourceAsStream("/sample-data/sample_data.json")) {
            ImportReport rep = engine.importQuantities(storage.loadQuantities(in));
            status.setText("Sample data loaded. " + rep);
        } catch (Exception ex) { showError(ex); }
    }

    public void importJson() {
        FileChooser fc = new FileChooser();
        fc.setTitle("Import Quantities JSON");
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("JSON", "*.json"));
        Window w = getScene() == null ? null : getScene().getWindow();
        File f = fc.showOpenDialog(w);
        if (f == null) return;
        try {
            ImportReport rep = engine.importQuantities(storage.loadQuantities(f));
            status.setText(f.getName() + ": " + rep);
        } catch (Exception ex) { showError(ex); }
    }

    public void resetToDefaults() {
        engine.resetToDefaults();
        status.setText("Reset to defaults.");
    }

    // ---------- RENDER ----------
    private void refresh() {
        AnalyticsReport r = engine.report();
        totalLabel.setText(String.format("%.2f kg", r.totalWasteKg));
        bricksLabel.setText(String.valueOf(r.bricks));
        volumeLabel.setText(String.format("%.4f", r.volumeDivertedM3));
        areaLabel.setText(String.format("%.3f", r.areaReducedM2));
        landfillBar.setProgress(Math.max(0.0, Math.min(1.0, r.percentReduced / 100.0)));
        percentLabel.setText(String.format("%.2f%% of landfill area reduced", r.percentReduced));

        List<MaterialEntry> entries = engine.orderedEntries();
        for (MaterialEntry e : entries) {
            TextField tf = valueFields.get(e.label);
            if (tf != null && !tf.isFocused()) tf.setText(format(e.quantity));
        }
        for (var e : settingFields.entrySet()) {
            if (!e.getValue().isFocused()) e.getValue().setText(format(engine.getSetting(e.getKey())));
        }
        refreshPie(entries);
    }

    private void refreshPie(List<MaterialEntry> entries) {
        List<CompositionBreakdown.Slice> slices = breakdown.compute(entries);
        ObservableList<PieChart.Data> data = FXCollections.observableArrayList();
        for (CompositionBreakdown.Slice s : slices) {
            data.add(new PieChart.Data(String.format("%s %.0f%%", s.label, s.percent), s.quantity));
        }
        pie.setData(data);
        // nodes exist only after setData
        for (int i = 0; i < slices.size(); i++) {
            var node = data.get(i).getNode();
            if (node != null) node.setStyle("-fx-pie-color: " + PALETTE[slices.get(i).colorIndex % PALETTE.length] + ";");
        }
    }

    private static Label sectionTitle(String text) {
        Label l = new Label(text);
        l.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");
        return l;
    }

    private static HBox infoRow(String title, Label value) {
        Label t = new Label(title);
        value.setStyle("-fx-font-weight: bold; -fx-text-fill: #00897b;");
        HBox spacer = new HBox();
        HBox.setHgrow(spacer, Priority.ALWAYS);
        HBox row = new HBox(8, t, spacer, value);
        row.setPadding(new Insets(8));
        row.setStyle("-fx-background-color: rgba(0,0,0,0.05); -fx-background-radius: 8;");
        return row;
    }

    private static String format(Double d) {
        return d == null ? "" : String.valueOf(d);
    }

    private void showError(Throwable ex) {
        log.warn("UI error", ex);
        Alert a = new Alert(Alert.AlertType.ERROR, ex.getMessage() == null ? String.valueOf(ex) : ex.getMessage(), ButtonType.OK);
        a.setHeaderText("Error"); a.showAndWait();
    }
}
