package com.mktsim.engine.agent;

import java.util.Random;

/**
 * Source of fundamental prices for agents. The kernel and the book never call
 * it; prices agents derive from it reach the book as plain integer cents.
 */
public interface Oracle {

    /** True fundamental price of {@code symbol} at {@code time}, in cents. */
    long priceAt(String symbol, long time);

    /**
     * Noisy observation of the fundamental: Gaussian noise of variance
     * {@code sigmaN} around {@link #priceAt}, rounded to cents.
     */
    default long observe(String symbol, long time, double sigmaN, Random random) {
        long truePrice = priceAt(symbol, time);
        if (sigmaN == 0.0) return truePrice;
        return Math.round(truePrice + random.nextGaussian() * Math.sqrt(sigmaN));
    }
}
