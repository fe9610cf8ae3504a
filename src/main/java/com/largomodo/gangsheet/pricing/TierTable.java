package com.largomodo.gangsheet.pricing;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;

/**
 * Ordered price table keyed by maximum sheet length.
 * <p>
 * Thresholds are strictly increasing. The table is loaded from a properties
 * file where each key is a threshold in inches and each value its price:
 * <pre>
 * 12=5.28
 * 24=10.56
 * </pre>
 */
public final class TierTable {

    /** Classpath location of the bundled price list. */
    public static final String DEFAULT_RESOURCE = "/gangsheet/cost-tiers.properties";

    private final List<CostTier> tiers;

    /**
     * @param tiers tiers in strictly increasing threshold order, not empty
     * @throws IllegalArgumentException if empty or thresholds are not strictly increasing
     */
    public TierTable(List<CostTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Tier table must contain at least one tier");
        }
        for (int i = 1; i < tiers.size(); i++) {
            if (tiers.get(i).thresholdInches() <= tiers.get(i - 1).thresholdInches()) {
                throw new IllegalArgumentException("Tier thresholds must be strictly increasing: "
                        + tiers.get(i - 1).thresholdInches() + " then " + tiers.get(i).thresholdInches());
            }
        }
        this.tiers = List.copyOf(tiers);
    }

    /**
     * Loads the price list bundled with the application.
     *
     * @throws IOException if the resource is missing or malformed
     */
    public static TierTable defaults() throws IOException {
        try (InputStream in = TierTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Internal resource " + DEFAULT_RESOURCE + " not found. "
                        + "Ensure application is built correctly.");
            }
            return load(in);
        }
    }

    public static TierTable load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            return fromProperties(properties, file.toString());
        }
    }

    public static TierTable load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return fromProperties(properties, DEFAULT_RESOURCE);
    }

    private static TierTable fromProperties(Properties properties, String source) throws IOException {
        List<CostTier> tiers = new ArrayList<>();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key).trim();
            try {
                tiers.add(new CostTier(Double.parseDouble(key.trim()), new BigDecimal(value)));
            } catch (IllegalArgumentException e) {
                // NumberFormatException included
                throw new IOException("Invalid tier '" + key + "=" + value + "' in " + source, e);
            }
        }
        if (tiers.isEmpty()) {
            throw new IOException("No price tiers defined in " + source);
        }
        tiers.sort(Comparator.comparingDouble(CostTier::thresholdInches));
        try {
            return new TierTable(tiers);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid price table in " + source + ": " + e.getMessage(), e);
        }
    }

    public List<CostTier> tiers() {
        return tiers;
    }

    public CostTier maxTier() {
        return tiers.get(tiers.size() - 1);
    }
}
