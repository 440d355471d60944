package org.carma.housing.mechanism;

import org.carma.housing.event.Event;
import org.carma.housing.event.EventBus;
import org.carma.housing.model.Agent;
import org.carma.housing.model.HousingMarket;
import org.carma.housing.model.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Greedy, order-dependent market clearing.
 *
 * Agents are first ordered by a {@link ClearingPolicy}; then each agent, in
 * that order, gets exactly one purchase attempt against the shared market.
 * Every attempt sees the properties sold by all earlier attempts, so a pass
 * runs on a single thread and holds the market's monitor for its duration.
 *
 * Ties in income keep the incoming order (stable sort), so the outcome of a
 * pass depends only on the population, the market, the policy and the seed.
 */
public class MarketClearingEngine {

    private static final Logger log = LoggerFactory.getLogger(MarketClearingEngine.class);

    private final Random random;
    private final EventBus eventBus;

    public MarketClearingEngine(Random random, EventBus eventBus) {
        this.random = random;
        this.eventBus = eventBus;
    }

    public MarketClearingEngine(long seed) {
        this(new Random(seed), null);
    }

    // ========================================================================
    // Ordering
    // ========================================================================

    /**
     * Return a new list with the agents in clearing order. The input is not modified.
     */
    public List<Agent> order(List<Agent> agents, ClearingPolicy policy) {
        List<Agent> ordered = new ArrayList<>(agents);
        switch (policy) {
            case INCOME_ORDER_DESCENDANT ->
                ordered.sort(Comparator.comparingDouble(Agent::getAnnualIncome).reversed());
            case INCOME_ORDER_ASCENDANT ->
                ordered.sort(Comparator.comparingDouble(Agent::getAnnualIncome));
            case RANDOM -> Collections.shuffle(ordered, random);
        }
        return ordered;
    }

    // ========================================================================
    // Clearing
    // ========================================================================

    /**
     * Order the agents and run one allocation pass.
     */
    public ClearingResult clear(List<Agent> agents, HousingMarket market, ClearingPolicy policy) {
        return allocate(order(agents, policy), market, policy);
    }

    /**
     * Run one allocation pass over agents that are already in clearing order.
     *
     * The pass is a fold over the ordered agents: each turn reads the market
     * as left by the previous turns and appends its outcome to the result.
     */
    public ClearingResult allocate(List<Agent> ordered, HousingMarket market, ClearingPolicy policy) {
        long start = System.currentTimeMillis();
        ClearingResult result = new ClearingResult(policy);

        synchronized (market) {
            int position = 0;
            for (Agent agent : ordered) {
                result = turn(result, agent, market, position++);
            }
        }

        result.setComputationTimeMs(System.currentTimeMillis() - start);
        log.info("Cleared market with policy {}: {} of {} agents bought, {} of {} properties left",
            policy.name(), result.getPurchaseCount(), ordered.size(),
            market.getAvailableCount(), market.size());
        return result;
    }

    private ClearingResult turn(ClearingResult result, Agent agent, HousingMarket market, int position) {
        result.recordTurn(agent.getId());
        if (agent.isHomeowner()) {
            return result;
        }
        Optional<Property> bought = agent.attemptPurchase(market);

        if (bought.isPresent()) {
            Property property = bought.get();
            result.recordPurchase(new ClearingResult.Purchase(
                agent.getId(), property.getId(), property.getPrice(), position));
            publish(new Event.PropertyPurchasedEvent(Instant.now(), agent.getId(), agent.getSegment(),
                property.getId(), property.getPrice(), position));
        } else {
            result.recordUnhoused(agent.getId());
            publish(new Event.PurchaseDeclinedEvent(Instant.now(), agent.getId(), agent.getSegment(),
                agent.getSavings(), position));
        }
        return result;
    }

    private void publish(Event event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }
}
