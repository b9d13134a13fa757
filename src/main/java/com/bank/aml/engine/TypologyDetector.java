package com.bank.aml.engine;

import com.bank.aml.model.AdjudicationInput;
import com.bank.aml.model.Typology;
import com.bank.aml.model.TypologyMatch;

/**
 * Interface for all typology detectors.
 * Each implementation recognizes one money-laundering typology.
 */
public interface TypologyDetector {

    /**
     * The typology this detector recognizes.
     */
    Typology getTypology();

    /**
     * Evaluate the escalated transaction against this typology's signals.
     *
     * @param input the adjudication input (transaction, gate scores, account stats)
     * @return the match, or {@code null} when the accumulated confidence stays below the activation floor
     */
    TypologyMatch detect(AdjudicationInput input);
}
