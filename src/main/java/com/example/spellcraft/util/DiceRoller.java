package com.example.spellcraft.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rolls dice expressions used by spell data.
 *
 * Accepted forms:
 *   NdM, NdM+K, NdM-K  - sum of N rolls of an M-sided die plus a modifier
 *   -NdM               - same roll, negated (drain amounts are written this way)
 *   +NdM               - leading plus is ignored (enhancement amounts)
 *   K                  - flat value
 *   A-B                - uniform value in the inclusive range [A, B]
 *
 * Anything else, including numbers outside the int range, rolls 0.
 */
public class DiceRoller {

    private static final Logger logger = LoggerFactory.getLogger(DiceRoller.class);

    private static final Pattern DICE_PATTERN = Pattern.compile("(\\d+)d(\\d+)([+-]\\d+)?");
    private static final Pattern RANGE_PATTERN = Pattern.compile("(\\d+)-(\\d+)");
    private static final Pattern FLAT_PATTERN = Pattern.compile("\\d+");

    /** Upper bound on dice rolled for one expression; larger counts roll this many. */
    static final int MAX_DICE = 1000;

    private final Random random;

    public DiceRoller() {
        this(null);
    }

    /**
     * @param random source of rolls; null uses ThreadLocalRandom
     */
    public DiceRoller(Random random) {
        this.random = random;
    }

    /**
     * Roll a dice expression.
     * @return the rolled total, or 0 when the expression cannot be parsed
     */
    public int roll(String expression) {
        if (expression == null) return 0;
        String expr = expression.toLowerCase().replace(" ", "");
        if (expr.isEmpty()) return 0;

        boolean negative = false;
        if (expr.startsWith("-")) {
            negative = true;
            expr = expr.substring(1);
        } else if (expr.startsWith("+")) {
            expr = expr.substring(1);
        }

        Integer total = rollUnsigned(expr);
        if (total == null) {
            logger.warn("[DiceRoller] Unparseable dice expression '{}'", expression);
            return 0;
        }
        return negative ? -total : total;
    }

    /**
     * Roll and return the magnitude, for amounts stored with a sign (e.g. "-1d5").
     */
    public int rollMagnitude(String expression) {
        return Math.abs(roll(expression));
    }

    /**
     * Uniform integer in [0, bound).
     */
    public int nextIndex(int bound) {
        if (bound <= 1) return 0;
        return rng().nextInt(bound);
    }

    /**
     * Uniform double in [0, 1).
     */
    public double nextChance() {
        return rng().nextDouble();
    }

    private Integer rollUnsigned(String expr) {
        try {
            return rollParsed(expr);
        } catch (NumberFormatException e) {
            logger.debug("[DiceRoller] Number out of range in '{}'", expr);
            return null;
        }
    }

    private Integer rollParsed(String expr) {
        Matcher m = DICE_PATTERN.matcher(expr);
        if (m.matches()) {
            int count = Math.min(Integer.parseInt(m.group(1)), MAX_DICE);
            int sides = Integer.parseInt(m.group(2));
            int modifier = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
            long total = modifier;
            for (int i = 0; i < count && sides > 0; i++) {
                total += rng().nextInt(sides) + 1;
            }
            return clampToInt(total);
        }

        m = RANGE_PATTERN.matcher(expr);
        if (m.matches()) {
            int low = Integer.parseInt(m.group(1));
            int high = Integer.parseInt(m.group(2));
            if (high < low) {
                int t = low;
                low = high;
                high = t;
            }
            long span = (long) high - low + 1;
            if (span > Integer.MAX_VALUE) {
                return null;
            }
            return low + rng().nextInt((int) span);
        }

        if (FLAT_PATTERN.matcher(expr).matches()) {
            return Integer.parseInt(expr);
        }
        return null;
    }

    private static int clampToInt(long value) {
        return (int) Math.max(-Integer.MAX_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private Random rng() {
        return random != null ? random : ThreadLocalRandom.current();
    }
}
