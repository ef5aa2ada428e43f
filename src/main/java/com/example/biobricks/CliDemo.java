package com.example.biobricks;

import com.example.biobricks.engine.*;
import com.example.biobricks.model.*;
import com.example.biobricks.services.CompositionBreakdown;
import com.example.biobricks.storage.JsonStorage;
import java.io.InputStream;

/** Console rendition: analytics for the defaults, then after importing the bundled sample data. */
public class CliDemo {
    public static void main(String[] args) throws Exception {
        try (ConversionEngine engine = new ConversionEngine()) {
            print("Defaults", engine);

            try (InputStream in = CliDemo.class.getResourceAsStream("/sample-data/sample_data.json")) {
                ImportReport rep = engine.importQuantities(new JsonStorage().loadQuantities(in));
                System.out.println("\n" + rep);
            }
            print("Sample data", engine);
        }
    }

    private static void print(String title, ConversionEngine engine) {
        System.out.println("== " + title + " (" + engine.settings() + ")");
        for (MaterialEntry e : engine.orderedEntries()) System.out.printf(" - %-16s %8.2f kg%n", e.label, e.quantity);
        System.out.println(engine.report());
        for (CompositionBreakdown.Slice s : new CompositionBreakdown().compute(engine.orderedEntries())) {
            System.out.print(" [" + s + "]");
        }
        System.out.println();
    }
}
