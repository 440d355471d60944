package org.carma.housing.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * A property listed in the housing market.
 *
 * Shape attributes are fixed at construction. Two fields change during a run,
 * each at most once:
 * - the quality score, assigned lazily by {@link #assignQualityScore(int)}
 * - the availability flag, cleared by {@link #markSold()}
 */
public class Property {

    /** Year used when no reference year is given. */
    public static final int DEFAULT_REFERENCE_YEAR = 2024;

    /** Houses younger than this many years count as new construction. */
    public static final int NEW_CONSTRUCTION_YEARS = 5;

    private final int id;
    private final double price;
    private final double area;
    private final int bedrooms;
    private final int yearBuilt;
    private QualityScore qualityScore;
    private boolean available;

    public Property(int id, double price, double area, int bedrooms, int yearBuilt,
                    QualityScore qualityScore, boolean available) {
        if (price <= 0) throw new IllegalArgumentException("Price must be positive for property " + id);
        if (area < 0) throw new IllegalArgumentException("Area cannot be negative for property " + id);
        if (bedrooms < 0) throw new IllegalArgumentException("Bedrooms cannot be negative for property " + id);
        this.id = id;
        this.price = price;
        this.area = area;
        this.bedrooms = bedrooms;
        this.yearBuilt = yearBuilt;
        this.qualityScore = qualityScore;
        this.available = available;
    }

    /**
     * Available property without a quality score.
     */
    public Property(int id, double price, double area, int bedrooms, int yearBuilt) {
        this(id, price, area, bedrooms, yearBuilt, null, true);
    }

    /**
     * Build a property from an input row.
     */
    public static Property fromRow(MarketRow row) {
        return new Property(row.id(), row.price(), row.area(), row.bedrooms(), row.yearBuilt(),
            row.qualityScore(), row.available());
    }

    // ========================================================================
    // Derived Metrics
    // ========================================================================

    /**
     * Price divided by area, rounded half-even to 2 decimal places on the exact binary quotient.
     * @throws ArithmeticException if the area is zero
     */
    public double pricePerArea() {
        if (area == 0) {
            throw new ArithmeticException("Area cannot be zero when calculating price per area (property " + id + ")");
        }
        return new BigDecimal(price / area).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * True if the house is less than {@value #NEW_CONSTRUCTION_YEARS} years old at the reference year.
     */
    public boolean isNewConstruction(int referenceYear) {
        return referenceYear - yearBuilt < NEW_CONSTRUCTION_YEARS;
    }

    public boolean isNewConstruction() {
        return isNewConstruction(DEFAULT_REFERENCE_YEAR);
    }

    /**
     * Assign a quality score from age, size and bedrooms. No-op once a score is present.
     *
     * Age bands give the base score (under 5 years: 5, under 15: 4, under 30: 3,
     * under 50: 2, otherwise 1); more than 2000 of area and more than 3 bedrooms
     * each add one point, capped at 5.
     *
     * @return the stored score
     */
    public QualityScore assignQualityScore(int referenceYear) {
        if (qualityScore != null) {
            return qualityScore;
        }

        int age = referenceYear - yearBuilt;
        int base;
        if (age < 5) {
            base = 5;
        } else if (age < 15) {
            base = 4;
        } else if (age < 30) {
            base = 3;
        } else if (age < 50) {
            base = 2;
        } else {
            base = 1;
        }

        int sizeBonus = area > 2000 ? 1 : 0;
        int bedroomBonus = bedrooms > 3 ? 1 : 0;

        qualityScore = QualityScore.of(Math.min(base + sizeBonus + bedroomBonus, 5));
        return qualityScore;
    }

    /**
     * Mark the property as sold. Calling it again has no effect.
     */
    public void markSold() {
        available = false;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getId() {
        return id;
    }

    public double getPrice() {
        return price;
    }

    public double getArea() {
        return area;
    }

    public int getBedrooms() {
        return bedrooms;
    }

    public int getYearBuilt() {
        return yearBuilt;
    }

    public Optional<QualityScore> getQualityScore() {
        return Optional.ofNullable(qualityScore);
    }

    public boolean hasQualityScore() {
        return qualityScore != null;
    }

    public boolean isAvailable() {
        return available;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Property property = (Property) o;
        return id == property.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Property[%d: price=%.2f, area=%.1f, bedrooms=%d, built=%d, quality=%s, %s]",
            id, price, area, bedrooms, yearBuilt, qualityScore, available ? "available" : "sold");
    }
}
