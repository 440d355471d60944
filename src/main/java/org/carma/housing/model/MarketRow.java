package org.carma.housing.model;

import java.util.Map;

/**
 * One row of market seed data, as handed over by an external tabular loader.
 *
 * @param qualityScore may be null when the source has no score
 */
public record MarketRow(
        int id,
        double price,
        double area,
        int bedrooms,
        int yearBuilt,
        QualityScore qualityScore,
        boolean available) {

    public MarketRow(int id, double price, double area, int bedrooms, int yearBuilt) {
        this(id, price, area, bedrooms, yearBuilt, null, true);
    }

    /**
     * Read a row from a generic record using the column names
     * {@code id, price, area, bedrooms, year_built, quality_score, available}.
     * The last two are optional.
     *
     * @throws IllegalArgumentException if a required column is missing or not numeric
     */
    public static MarketRow fromMap(Map<String, Object> raw) {
        Object quality = raw.get("quality_score");
        Object available = raw.get("available");
        return new MarketRow(
            requireNumber(raw, "id").intValue(),
            requireNumber(raw, "price").doubleValue(),
            requireNumber(raw, "area").doubleValue(),
            requireNumber(raw, "bedrooms").intValue(),
            requireNumber(raw, "year_built").intValue(),
            quality instanceof Number ? QualityScore.of(((Number) quality).intValue()) : null,
            !(available instanceof Boolean) || (Boolean) available);
    }

    private static Number requireNumber(Map<String, Object> raw, String column) {
        Object value = raw.get(column);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Market row " + raw + " is missing numeric column '" + column + "'");
        }
        return (Number) value;
    }
}
