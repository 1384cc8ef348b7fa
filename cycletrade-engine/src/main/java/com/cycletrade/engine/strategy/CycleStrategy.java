package com.cycletrade.engine.strategy;

import com.cycletrade.core.indicators.SignalSnapshot;
import com.cycletrade.core.model.ExitReason;
import com.cycletrade.core.model.Phase;
import com.cycletrade.engine.order.LimitOrderManager;
import com.cycletrade.engine.order.Position;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Hooks the backtest driver calls on every bar with sufficient indicator history.
 *
 * <p>Defaults implement the band entry (buy below the lower band) and the phase exit: bear phases
 * sell back at the EMA, consolidation at the midpoint of P95 and the EMA, bull phases at P95.</p>
 */
public interface CycleStrategy {

    /**
     * Whether to place a buy order on this bar. Phase gating is applied separately.
     */
    boolean entryPredicate(BarContext ctx);

    /**
     * Buy limit price: {@code min(P5, close, (P5 + mid) / 2) * (1 - discount)}.
     *
     * @return null when the bands do not give a usable price
     */
    default BigDecimal entryPrice(BarContext ctx) {
        SignalSnapshot s = ctx.signals();
        if (!(s.p5() > 0) || !(s.inertiaMid() > 0)) {
            return null;
        }
        double base = Math.min(s.p5(), Math.min(s.close(), (s.p5() + s.inertiaMid()) / 2));
        BigDecimal price = BigDecimal.valueOf(base)
            .multiply(BigDecimal.ONE.subtract(ctx.params().discount()));
        return price.setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.DOWN);
    }

    /**
     * Multiplier applied to the dynamic order size.
     */
    default BigDecimal sizeFactor(BarContext ctx) {
        return BigDecimal.ONE;
    }

    /**
     * Sell target for an open position on this bar, capped by the take-profit rate when set.
     */
    default ExitTarget exitTarget(BarContext ctx, Position position) {
        ExitTarget target = phaseTarget(ctx.signals(), ctx.phase());
        BigDecimal takeProfit = ctx.params().takeProfitRate();
        if (takeProfit != null && takeProfit.signum() > 0) {
            BigDecimal cap = position.getEntryPrice().multiply(BigDecimal.ONE.add(takeProfit))
                .setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.HALF_UP);
            if (cap.compareTo(target.price()) < 0) {
                return new ExitTarget(cap, ExitReason.TAKE_PROFIT_CAP);
            }
        }
        return target;
    }

    /**
     * Stop price of a position, or null when no stop loss is configured.
     */
    default BigDecimal stopPrice(Position position, StrategyParams params) {
        BigDecimal rate = params.stopLossRate();
        if (rate == null || rate.signum() <= 0) {
            return null;
        }
        return position.getEntryPrice().multiply(BigDecimal.ONE.subtract(rate))
            .setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Phase-driven sell price from the current bands.
     */
    static ExitTarget phaseTarget(SignalSnapshot s, Phase phase) {
        double price = switch (phase) {
            case BEAR_WARNING, BEAR_STRONG -> s.ema();
            case CONSOLIDATION -> (s.p95() + s.ema()) / 2;
            case BULL_WARNING, BULL_STRONG -> s.p95();
        };
        return new ExitTarget(
            BigDecimal.valueOf(price).setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.HALF_UP),
            ExitReason.forPhase(phase));
    }
}
