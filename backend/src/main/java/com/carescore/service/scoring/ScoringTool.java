package com.carescore.service.scoring;

import com.carescore.model.enums.ToolType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A standardized instrument: its categories, its total range and how a total translates
 * into risk. Each tool owns its category set, so a category from one tool is never
 * accepted by another.
 */
public abstract class ScoringTool {

    private final ToolType type;
    private final int minTotal;
    private final int maxTotal;
    private final List<CategoryRule> rules;

    protected ScoringTool(ToolType type, int minTotal, int maxTotal, List<CategoryRule> rules) {
        this.type = type;
        this.minTotal = minTotal;
        this.maxTotal = maxTotal;
        this.rules = List.copyOf(rules);
    }

    public ToolType getType() {
        return type;
    }

    public int getMinTotal() {
        return minTotal;
    }

    public int getMaxTotal() {
        return maxTotal;
    }

    public List<CategoryRule> getRules() {
        return rules;
    }

    public Set<String> categoryNames() {
        return rules.stream().map(CategoryRule::name).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Validates and sums the categories, then places the total in a band.
     * Unknown keys and missing categories produce warnings; missing ones count as zero.
     */
    public ToolScore score(Map<String, Integer> categories, List<ScoreBand> bands) {
        Map<String, Integer> input = categories == null ? Collections.emptyMap() : categories;
        List<String> warnings = new ArrayList<>();

        Set<String> known = categoryNames();
        input.keySet().stream()
            .filter(key -> !known.contains(key))
            .sorted()
            .forEach(key -> warnings.add("Unknown category '" + key + "' ignored"));

        Map<String, Integer> values = new LinkedHashMap<>();
        int supplied = 0;
        int sum = 0;
        for (CategoryRule rule : rules) {
            Integer value = input.get(rule.name());
            if (value == null) {
                warnings.add("Missing category '" + rule.name() + "' counted as 0");
                continue;
            }
            rule.validate(value);
            values.put(rule.name(), value);
            sum += value;
            supplied++;
        }

        int total = boundTotal(sum);
        if (total != sum) {
            warnings.add("Total " + sum + " outside the scale range, reported as " + total);
        }
        ScoreBand band = bandFor(total, bands);
        double completeness = rules.isEmpty() ? 1.0 : (double) supplied / rules.size();

        return new ToolScore(type, total, band.getLabel(), band.getRiskLevel(),
            List.copyOf(warnings), completeness, Collections.unmodifiableMap(values));
    }

    /**
     * Band containing the total. A total outside every band (only possible for partial input)
     * goes to the nearest band.
     */
    public static ScoreBand bandFor(int total, List<ScoreBand> bands) {
        ScoreBand nearest = null;
        int nearestDistance = Integer.MAX_VALUE;
        for (ScoreBand band : bands) {
            if (band.contains(total)) {
                return band;
            }
            int distance = total < band.getMin() ? band.getMin() - total : total - band.getMax();
            if (distance < nearestDistance) {
                nearest = band;
                nearestDistance = distance;
            }
        }
        if (nearest == null) {
            throw new IllegalStateException("No score bands configured");
        }
        return nearest;
    }

    /**
     * True when a higher total means more risk. Trend series are flipped for such tools so that
     * a rising series always means improvement.
     */
    public boolean higherIsRiskier() {
        return false;
    }

    /**
     * Total on a "higher is better" scale.
     */
    public double orientedTotal(int total) {
        return higherIsRiskier() ? maxTotal - total : total;
    }

    /**
     * Category value on a "higher is better" scale.
     */
    public double orientedCategory(CategoryRule rule, int value) {
        return higherIsRiskier() ? rule.max() - value : value;
    }

    protected int boundTotal(int sum) {
        return Math.max(minTotal, Math.min(sum, maxTotal));
    }

    /**
     * Risk on a 0..100 scale where higher always means riskier.
     */
    public abstract double normalize(int total);

    /**
     * Human-readable factors that drove the score, in category order.
     */
    public abstract List<String> contributingFactors(Map<String, Integer> values);

    protected static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    protected static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
