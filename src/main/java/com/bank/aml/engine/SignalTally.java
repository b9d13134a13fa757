package com.bank.aml.engine;

import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates weighted signals for one detector invocation.
 * The activation floor is checked against the raw sum; the match clamps it.
 */
public final class SignalTally {

    private final Typology typology;
    private final List<String> signals = new ArrayList<>();
    private double confidence;

    public SignalTally(Typology typology) {
        this.typology = typology;
    }

    public SignalTally check(boolean condition, String signal, double weight) {
        if (condition) {
            signals.add(signal);
            confidence += weight;
        }
        return this;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getSignals() {
        return List.copyOf(signals);
    }

    public TypologyMatch matchIfAtLeast(double activationFloor) {
        if (signals.isEmpty() || confidence < activationFloor) {
            return null;
        }
        return TypologyMatch.of(typology, confidence, signals);
    }
}
