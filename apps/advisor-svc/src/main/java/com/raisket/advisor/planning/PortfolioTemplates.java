package com.raisket.advisor.planning;

import com.raisket.advisor.model.Instrument;
import com.raisket.advisor.model.Instrument.AssetClass;
import com.raisket.advisor.model.Instrument.Liquidity;
import com.raisket.advisor.model.Instrument.RiskLevel;
import com.raisket.advisor.model.RiskProfile;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static allocation templates per risk profile. Weights in every template add up to 100.
 */
public final class PortfolioTemplates {

    private static final Map<RiskProfile, Template> TEMPLATES = new EnumMap<>(RiskProfile.class);

    static {
        register(RiskProfile.CONSERVATIVE, List.of(
                instrument("CETES 28-day treasury bills", AssetClass.FIXED_INCOME, "40", "10.50", RiskLevel.LOW, Liquidity.SHORT_TERM),
                instrument("High-yield savings account", AssetClass.FIXED_INCOME, "30", "9.00", RiskLevel.LOW, Liquidity.IMMEDIATE),
                instrument("Government bond fund", AssetClass.FIXED_INCOME, "20", "9.50", RiskLevel.LOW, Liquidity.LONG_TERM),
                instrument("Balanced fund", AssetClass.MIXED, "10", "11.00", RiskLevel.MEDIUM, Liquidity.SHORT_TERM)
        ));
        register(RiskProfile.MODERATE, List.of(
                instrument("CETES 28-day treasury bills", AssetClass.FIXED_INCOME, "30", "10.50", RiskLevel.LOW, Liquidity.SHORT_TERM),
                instrument("Corporate bond fund", AssetClass.FIXED_INCOME, "20", "11.00", RiskLevel.MEDIUM, Liquidity.LONG_TERM),
                instrument("Balanced fund", AssetClass.MIXED, "20", "11.00", RiskLevel.MEDIUM, Liquidity.SHORT_TERM),
                instrument("Mexican equity index ETF", AssetClass.EQUITY, "30", "12.00", RiskLevel.HIGH, Liquidity.LONG_TERM)
        ));
        register(RiskProfile.AGGRESSIVE, List.of(
                instrument("CETES 28-day treasury bills", AssetClass.FIXED_INCOME, "10", "10.50", RiskLevel.LOW, Liquidity.SHORT_TERM),
                instrument("Balanced fund", AssetClass.MIXED, "15", "11.00", RiskLevel.MEDIUM, Liquidity.SHORT_TERM),
                instrument("Mexican equity index ETF", AssetClass.EQUITY, "35", "12.00", RiskLevel.HIGH, Liquidity.LONG_TERM),
                instrument("Global equity ETF", AssetClass.EQUITY, "40", "13.00", RiskLevel.HIGH, Liquidity.LONG_TERM)
        ));
    }

    private PortfolioTemplates() {
    }

    public static Template forProfile(RiskProfile profile) {
        Template template = TEMPLATES.get(profile);
        if (template == null) {
            throw new IllegalArgumentException("No portfolio template for " + profile);
        }
        return template;
    }

    private static void register(RiskProfile profile, List<Instrument> instruments) {
        BigDecimal weightSum = instruments.stream()
                .map(Instrument::weightPercent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (weightSum.compareTo(Money.HUNDRED) != 0) {
            throw new IllegalStateException("Template " + profile + " weights sum to " + weightSum + ", expected 100");
        }
        BigDecimal blended = instruments.stream()
                .map(instrument -> instrument.weightPercent().multiply(instrument.expectedAnnualReturn()))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(Money.HUNDRED, Money.CONTEXT);
        TEMPLATES.put(profile, new Template(profile, instruments, Money.round(blended)));
    }

    private static Instrument instrument(String name, AssetClass assetClass, String weight, String expectedReturn,
            RiskLevel riskLevel, Liquidity liquidity) {
        return new Instrument(name, assetClass, new BigDecimal(weight), new BigDecimal(expectedReturn), riskLevel, liquidity);
    }

    public record Template(RiskProfile profile, List<Instrument> instruments, BigDecimal blendedAnnualReturn) {
        public Template {
            instruments = List.copyOf(instruments);
        }
    }
}
