package com.example.biobricks;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.stage.Stage;
import javafx.scene.layout.BorderPane;
import javafx.scene.control.Menu;
import javafx.scene.control.MenuBar;
import javafx.scene.control.MenuItem;
import javafx.scene.control.SeparatorMenuItem;
import javafx.scene.input.KeyCombination;
import javafx.geometry.Insets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.example.biobricks.engine.ConversionEngine;
import com.example.biobricks.storage.JsonKeyValueStore;
import com.example.biobricks.ui.MainView;

public class App extends Application {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private ConversionEngine engine;

    @Override
    public void init() {
        JsonKeyValueStore store = new JsonKeyValueStore(JsonKeyValueStore.defaultLocation());
        engine = new ConversionEngine(store);
        try {
            engine.load();
        } catch (Exception ex) {
            log.warn("Starting from defaults; stored state at {} is unreadable", store.file(), ex);
        }
    }

    @Override
    public void start(Stage stage) {
        BorderPane root = new BorderPane();
        var main = new MainView(engine);
        root.setTop(buildMenu(main));
        root.setCenter(main);
        BorderPane.setMargin(main, new Insets(8));
        Scene scene = new Scene(root, 560, 820);
        stage.setTitle("Smart Bio Bricks");
        stage.setScene(scene);
        stage.show();
    }

    @Override
    public void stop() {
        engine.close();
    }

    private MenuBar buildMenu(MainView main) {
        Menu file = new Menu("File");
        MenuItem load = new MenuItem("Load Sample Data"); load.setOnAction(e -> main.loadSampleData());
        MenuItem importJson = new MenuItem("Import Quantities JSON…"); importJson.setOnAction(e -> main.importJson());
        MenuItem reset = new MenuItem("Reset to Defaults"); reset.setOnAction(e -> main.resetToDefaults());
        MenuItem exit = new MenuItem("Exit"); exit.setAccelerator(KeyCombination.keyCombination("Ctrl+Q")); exit.setOnAction(e -> Platform.exit());
        file.getItems().addAll(load, importJson, reset, new SeparatorMenuItem(), exit);
        return new MenuBar(file);
    }

    public static void main(String[] args) { launch(args); }
}
