package com.microfinance.domain.model;

import com.microfinance.infrastructure.persistence.entity.LoanConfigEntity;
import com.microfinance.infrastructure.persistence.entity.LoanTypeConfig;
import lombok.Value;

/**
 * Fee configuration in effect for one branch. Blocks missing from the stored
 * document are empty, never null.
 */
@Value
public class EffectiveLoanConfig {

    String sourceBranchCode;
    LoanTypeConfig express;
    LoanTypeConfig individual;
    LoanTypeConfig group;

    public static EffectiveLoanConfig empty() {
        return new EffectiveLoanConfig(null, new LoanTypeConfig(), new LoanTypeConfig(), new LoanTypeConfig());
    }

    public static EffectiveLoanConfig from(LoanConfigEntity entity) {
        return new EffectiveLoanConfig(
                entity.getBranchCode(),
                orEmpty(entity.getExpress()),
                orEmpty(entity.getIndividual()),
                orEmpty(entity.getGroup()));
    }

    public LoanTypeConfig forCategory(LoanCategory category) {
        if (category == null) {
            return new LoanTypeConfig();
        }
        switch (category) {
            case GROUP:
                return group;
            case INDIVIDUAL:
                return individual;
            default:
                return express;
        }
    }

    private static LoanTypeConfig orEmpty(LoanTypeConfig config) {
        return config == null ? new LoanTypeConfig() : config;
    }
}
