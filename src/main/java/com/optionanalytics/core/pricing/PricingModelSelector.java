package com.optionanalytics.core.pricing;

import com.optionanalytics.config.LatticeConfig;
import com.optionanalytics.domain.InputChecks;
import com.optionanalytics.domain.enums.PricingModelType;
import com.optionanalytics.domain.model.OptionContractSpec;
import org.springframework.stereotype.Component;

/**
 * Picks a {@link PricingModel} from a requested type and step count, or from the contract's
 * exercise style when no type is requested: European contracts get the closed form, American
 * contracts the lattice with the configured default step count.
 */
@Component
public class PricingModelSelector {

    private final BlackScholesMertonModel blackScholesMertonModel;
    private final LatticeConfig latticeConfig;

    public PricingModelSelector(BlackScholesMertonModel blackScholesMertonModel, LatticeConfig latticeConfig) {
        this.blackScholesMertonModel = blackScholesMertonModel;
        this.latticeConfig = latticeConfig;
    }

    /**
     * @param type     requested model, or null to choose by exercise style
     * @param steps    lattice step count, or null for the configured default; ignored by the closed form
     * @param contract contract to be priced, consulted only when {@code type} is null
     */
    public PricingModel select(PricingModelType type, Integer steps, OptionContractSpec contract) {
        PricingModelType resolved = type != null ? type : defaultTypeFor(contract);
        return select(resolved, steps);
    }

    public PricingModel select(PricingModelType type, Integer steps) {
        return switch (InputChecks.requirePresent("model", type)) {
            case BLACK_SCHOLES_MERTON -> blackScholesMertonModel;
            case CRR_BINOMIAL -> lattice(steps);
        };
    }

    public BinomialLatticeModel lattice(Integer steps) {
        int resolvedSteps = steps != null ? steps : latticeConfig.getDefaultSteps();
        return new BinomialLatticeModel(resolvedSteps, latticeConfig.getBumps());
    }

    public BlackScholesMertonModel closedForm() {
        return blackScholesMertonModel;
    }

    private static PricingModelType defaultTypeFor(OptionContractSpec contract) {
        return contract != null && contract.isAmerican()
                ? PricingModelType.CRR_BINOMIAL
                : PricingModelType.BLACK_SCHOLES_MERTON;
    }
}
