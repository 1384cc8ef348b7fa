package com.cycletrade.engine.config;

import com.cycletrade.core.cycle.CycleThresholds;
import com.cycletrade.core.indicators.IndicatorSettings;
import com.cycletrade.core.model.Phase;
import com.cycletrade.engine.order.SellRepricingPolicy;
import com.cycletrade.engine.risk.EntryGate;
import com.cycletrade.engine.strategy.StrategyParams;
import com.cycletrade.engine.strategy.StrategyType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Backtest configuration, loaded from YAML. Unknown keys are ignored and missing keys keep
 * their defaults. The driver copies what it needs at construction, so changes after that
 * do not affect a running backtest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BacktestConfig {

    private BigDecimal initialCapital = new BigDecimal("10000");
    private int maxPositions = 10;
    private int minLookbackBars = 30;
    private StrategyType strategy = StrategyType.LIMIT_ENTRY;
    private BigDecimal discount = new BigDecimal("0.001");
    private BigDecimal consolidationMultiplier = new BigDecimal("3");
    private BigDecimal takeProfitRate;
    private BigDecimal stopLossRate;
    private BigDecimal feeRate = BigDecimal.ZERO;
    private BigDecimal minOrderAmount = BigDecimal.TEN;
    private SellRepricingPolicy repricing = SellRepricingPolicy.FOLLOW;
    private List<Phase> blockedEntryPhases = new ArrayList<>(List.of(Phase.BEAR_WARNING));
    private List<String> instrumentOrder = new ArrayList<>();
    private IndicatorConfig indicators = new IndicatorConfig();
    private ThresholdConfig thresholds = new ThresholdConfig();

    public BigDecimal getInitialCapital() { return initialCapital; }
    public void setInitialCapital(BigDecimal initialCapital) { this.initialCapital = initialCapital; }

    public int getMaxPositions() { return maxPositions; }
    public void setMaxPositions(int maxPositions) { this.maxPositions = maxPositions; }

    public int getMinLookbackBars() { return minLookbackBars; }
    public void setMinLookbackBars(int minLookbackBars) { this.minLookbackBars = minLookbackBars; }

    public StrategyType getStrategy() { return strategy; }
    public void setStrategy(StrategyType strategy) { this.strategy = strategy; }

    public BigDecimal getDiscount() { return discount; }
    public void setDiscount(BigDecimal discount) { this.discount = discount; }

    public BigDecimal getConsolidationMultiplier() { return consolidationMultiplier; }
    public void setConsolidationMultiplier(BigDecimal consolidationMultiplier) { this.consolidationMultiplier = consolidationMultiplier; }

    public BigDecimal getTakeProfitRate() { return takeProfitRate; }
    public void setTakeProfitRate(BigDecimal takeProfitRate) { this.takeProfitRate = takeProfitRate; }

    public BigDecimal getStopLossRate() { return stopLossRate; }
    public void setStopLossRate(BigDecimal stopLossRate) { this.stopLossRate = stopLossRate; }

    public BigDecimal getFeeRate() { return feeRate; }
    public void setFeeRate(BigDecimal feeRate) { this.feeRate = feeRate; }

    public BigDecimal getMinOrderAmount() { return minOrderAmount; }
    public void setMinOrderAmount(BigDecimal minOrderAmount) { this.minOrderAmount = minOrderAmount; }

    public SellRepricingPolicy getRepricing() { return repricing; }
    public void setRepricing(SellRepricingPolicy repricing) { this.repricing = repricing; }

    public List<Phase> getBlockedEntryPhases() { return blockedEntryPhases; }
    public void setBlockedEntryPhases(List<Phase> blockedEntryPhases) { this.blockedEntryPhases = blockedEntryPhases; }

    public List<String> getInstrumentOrder() { return instrumentOrder; }
    public void setInstrumentOrder(List<String> instrumentOrder) { this.instrumentOrder = instrumentOrder; }

    public IndicatorConfig getIndicators() { return indicators; }
    public void setIndicators(IndicatorConfig indicators) { this.indicators = indicators; }

    public ThresholdConfig getThresholds() { return thresholds; }
    public void setThresholds(ThresholdConfig thresholds) { this.thresholds = thresholds; }

    /**
     * @throws IllegalArgumentException describing the first invalid value
     */
    public void validate() {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("initialCapital must be positive, got " + initialCapital);
        }
        if (maxPositions < 1) {
            throw new IllegalArgumentException("maxPositions must be >= 1, got " + maxPositions);
        }
        if (minLookbackBars < 1) {
            throw new IllegalArgumentException("minLookbackBars must be >= 1, got " + minLookbackBars);
        }
        requireRate("discount", discount, false);
        requireRate("feeRate", feeRate, false);
        requireRate("takeProfitRate", takeProfitRate, true);
        requireRate("stopLossRate", stopLossRate, true);
        if (consolidationMultiplier == null || consolidationMultiplier.signum() <= 0) {
            throw new IllegalArgumentException("consolidationMultiplier must be positive, got " + consolidationMultiplier);
        }
        if (minOrderAmount == null || minOrderAmount.signum() < 0) {
            throw new IllegalArgumentException("minOrderAmount must not be negative, got " + minOrderAmount);
        }
        toIndicatorSettings();
        toThresholds();
    }

    private static void requireRate(String name, BigDecimal rate, boolean optional) {
        if (rate == null) {
            if (optional) return;
            throw new IllegalArgumentException(name + " is required");
        }
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException(name + " must be in [0, 1), got " + rate);
        }
    }

    public IndicatorSettings toIndicatorSettings() {
        IndicatorConfig c = indicators != null ? indicators : new IndicatorConfig();
        return new IndicatorSettings(c.emaPeriod, c.ewmaWindow, c.adxPeriod, c.bandZScore, c.trendScale,
            c.inertiaBase, c.inertiaMin, c.inertiaMax, c.flatSlopeRatio);
    }

    public CycleThresholds toThresholds() {
        ThresholdConfig t = thresholds != null ? thresholds : new ThresholdConfig();
        return new CycleThresholds(t.bullWarning, t.bullStrong, t.bullExit, t.bearWarning, t.bearStrong, t.bearExit);
    }

    public StrategyParams toStrategyParams() {
        return new StrategyParams(discount, consolidationMultiplier, takeProfitRate, stopLossRate);
    }

    @JsonIgnore
    public EntryGate getEntryGate() {
        return blockedEntryPhases == null ? EntryGate.allowAll() : EntryGate.blocking(blockedEntryPhases);
    }

    public static BacktestConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new BacktestConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        BacktestConfig config = mapper.readValue(path.toFile(), BacktestConfig.class);
        config.validate();
        return config;
    }

    public static BacktestConfig fromYaml(String yaml) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        BacktestConfig config = mapper.readValue(yaml, BacktestConfig.class);
        config.validate();
        return config;
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".cycletrade", "backtest.yaml");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndicatorConfig {
        private int emaPeriod = 25;
        private int ewmaWindow = 50;
        private int adxPeriod = 14;
        private double bandZScore = 1.645;
        private double trendScale = 100.0;
        private double inertiaBase = 5.0;
        private double inertiaMin = 5.0;
        private double inertiaMax = 10.0;
        private double flatSlopeRatio = 0.0001;

        public int getEmaPeriod() { return emaPeriod; }
        public void setEmaPeriod(int emaPeriod) { this.emaPeriod = emaPeriod; }

        public int getEwmaWindow() { return ewmaWindow; }
        public void setEwmaWindow(int ewmaWindow) { this.ewmaWindow = ewmaWindow; }

        public int getAdxPeriod() { return adxPeriod; }
        public void setAdxPeriod(int adxPeriod) { this.adxPeriod = adxPeriod; }

        public double getBandZScore() { return bandZScore; }
        public void setBandZScore(double bandZScore) { this.bandZScore = bandZScore; }

        public double getTrendScale() { return trendScale; }
        public void setTrendScale(double trendScale) { this.trendScale = trendScale; }

        public double getInertiaBase() { return inertiaBase; }
        public void setInertiaBase(double inertiaBase) { this.inertiaBase = inertiaBase; }

        public double getInertiaMin() { return inertiaMin; }
        public void setInertiaMin(double inertiaMin) { this.inertiaMin = inertiaMin; }

        public double getInertiaMax() { return inertiaMax; }
        public void setInertiaMax(double inertiaMax) { this.inertiaMax = inertiaMax; }

        public double getFlatSlopeRatio() { return flatSlopeRatio; }
        public void setFlatSlopeRatio(double flatSlopeRatio) { this.flatSlopeRatio = flatSlopeRatio; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ThresholdConfig {
        private double bullWarning = 600;
        private double bullStrong = 1000;
        private double bullExit = 0;
        private double bearWarning = -600;
        private double bearStrong = -1000;
        private double bearExit = 0;

        public double getBullWarning() { return bullWarning; }
        public void setBullWarning(double bullWarning) { this.bullWarning = bullWarning; }

        public double getBullStrong() { return bullStrong; }
        public void setBullStrong(double bullStrong) { this.bullStrong = bullStrong; }

        public double getBullExit() { return bullExit; }
        public void setBullExit(double bullExit) { this.bullExit = bullExit; }

        public double getBearWarning() { return bearWarning; }
        public void setBearWarning(double bearWarning) { this.bearWarning = bearWarning; }

        public double getBearStrong() { return bearStrong; }
        public void setBearStrong(double bearStrong) { this.bearStrong = bearStrong; }

        public double getBearExit() { return bearExit; }
        public void setBearExit(double bearExit) { this.bearExit = bearExit; }
    }
}
