package org.carma.housing.mechanism;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one clearing pass.
 *
 * Contains:
 * - The policy and the agent order it produced
 * - Purchases in the order they happened
 * - Agents that ended the pass without a house
 */
public class ClearingResult {

    /**
     * One completed purchase. {@code position} is the buyer's index in the clearing order.
     */
    public record Purchase(int agentId, int propertyId, double price, int position) {
    }

    private final ClearingPolicy policy;
    private final List<Integer> order;
    private final Map<Integer, Purchase> purchases;
    private final List<Integer> unhoused;
    private long computationTimeMs;

    ClearingResult(ClearingPolicy policy) {
        this.policy = policy;
        this.order = new ArrayList<>();
        this.purchases = new LinkedHashMap<>();
        this.unhoused = new ArrayList<>();
    }

    // ========================================================================
    // Recording (engine only)
    // ========================================================================

    ClearingResult recordTurn(int agentId) {
        order.add(agentId);
        return this;
    }

    ClearingResult recordPurchase(Purchase purchase) {
        purchases.put(purchase.agentId(), purchase);
        return this;
    }

    ClearingResult recordUnhoused(int agentId) {
        unhoused.add(agentId);
        return this;
    }

    ClearingResult setComputationTimeMs(long ms) {
        this.computationTimeMs = ms;
        return this;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public ClearingPolicy getPolicy() {
        return policy;
    }

    public List<Integer> getOrder() {
        return Collections.unmodifiableList(order);
    }

    public List<Purchase> getPurchases() {
        return List.copyOf(purchases.values());
    }

    public Optional<Purchase> getPurchase(int agentId) {
        return Optional.ofNullable(purchases.get(agentId));
    }

    /**
     * Agent id to property id, in purchase order.
     */
    public Map<Integer, Integer> getAssignments() {
        Map<Integer, Integer> assignments = new LinkedHashMap<>();
        for (Purchase p : purchases.values()) {
            assignments.put(p.agentId(), p.propertyId());
        }
        return assignments;
    }

    public List<Integer> getUnhoused() {
        return Collections.unmodifiableList(unhoused);
    }

    public int getPurchaseCount() {
        return purchases.size();
    }

    public double getTotalSoldValue() {
        return purchases.values().stream().mapToDouble(Purchase::price).sum();
    }

    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    @Override
    public String toString() {
        return String.format("ClearingResult[%s: %d turns, %d purchases, %d unhoused, %dms]",
            policy.name(), order.size(), purchases.size(), unhoused.size(), computationTimeMs);
    }
}
