package com.giftsbuyer.domain.purchase;

/**
 * Budget math for one gift at purchase time.
 *
 * An unknown price (0) is treated as free so a failed price lookup never blocks purchasing.
 */
public record Affordability(int requested, int price, long balance, int affordable) {

    public static Affordability compute(int requested, int price, long balance) {
        if (requested < 0) throw new IllegalArgumentException("requested must be >= 0");
        int affordable;
        if (price > 0) {
            long byBudget = Math.max(0L, balance) / price;
            affordable = (int) Math.min(requested, byBudget);
        } else {
            affordable = requested;
        }
        return new Affordability(requested, price, balance, affordable);
    }

    public boolean none() {
        return affordable == 0;
    }

    public boolean partial() {
        return affordable < requested;
    }

    public int shortfallUnits() {
        return requested - affordable;
    }

    /** Stars missing to buy the full request: (requested - affordable) * price. */
    public long shortfallCost() {
        return (long) shortfallUnits() * price;
    }

    /** Cost of the full request, reported when nothing is affordable. */
    public long requestedCost() {
        return (long) requested * price;
    }
}
