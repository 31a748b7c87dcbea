package com.di.schemanova.agent;

import com.di.schemanova.agent.cleaning.CleaningNormalizer;
import com.di.schemanova.agent.cleaning.CleaningResult;
import com.di.schemanova.agent.cleaning.RawDataset;
import com.di.schemanova.agent.keys.KeyCandidate;
import com.di.schemanova.agent.keys.KeyCandidateDetector;
import com.di.schemanova.agent.profiler.ColumnProfile;
import com.di.schemanova.agent.profiler.ColumnProfiler;
import com.di.schemanova.agent.relationships.DatasetSnapshot;
import com.di.schemanova.agent.roles.TableRoleClassifier;
import com.di.schemanova.config.InferenceProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared fixtures: an Orders fact table and a Customers dimension that join on customer_id.
 */
public final class SampleDatasets {

    public static final List<String> REGIONS = List.of("north", "south", "east", "west");

    private SampleDatasets() {
    }

    /** 1000 orders over 100 customers; order_id unique, 40 distinct amounts as currency text. */
    public static RawDataset orders() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 1000; i++) {
            rows.add(List.of(i, (i % 100) + 1, String.format(Locale.ROOT, "$%d.%02d", 10 + i % 40, (i % 4) * 25)));
        }
        return RawDataset.of("Orders", List.of("order_id", "customer_id", "amount"), rows);
    }

    /** 100 customers with unique ids and names, four regions. */
    public static RawDataset customers() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 100; i++) {
            rows.add(List.of(i, "Customer " + i, REGIONS.get(i % REGIONS.size())));
        }
        return RawDataset.of("Customers", List.of("customer_id", "name", "region"), rows);
    }

    public static RawDataset of(String name, List<String> columns, List<List<Object>> rows) {
        return RawDataset.of(name, columns, rows);
    }

    /** Runs stages 1-4 with default settings and returns the snapshot the relationship stage sees. */
    public static DatasetSnapshot snapshot(RawDataset raw) {
        InferenceProperties properties = new InferenceProperties();
        CleaningResult cleaned = new CleaningNormalizer(properties).clean(raw);
        List<ColumnProfile> profiles = new ColumnProfiler(properties).profile(cleaned);
        List<KeyCandidate> keys = new KeyCandidateDetector(properties).detect(cleaned.getDataset(), profiles);
        return new DatasetSnapshot(cleaned.getDataset(), profiles, keys,
                new TableRoleClassifier(properties).classify(raw.getName(), profiles, keys).getRole());
    }
}
