package org.nowstart.edgeguard.backtest.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.EquityPoint;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.property.CostProperties;
import org.nowstart.edgeguard.data.property.RiskProperties;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.service.position.Position;

/**
 * Shared cash account of one backtest run. Fills pay slippage, half the spread and the fee rate.
 */
@Slf4j
class BacktestAccount {

    private final CostProperties costs;
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();
    private double cash;
    private LocalDate lossDate;
    private double dailyLoss;

    BacktestAccount(double initialEquity, CostProperties costs) {
        this.cash = initialEquity;
        this.costs = costs;
    }

    Map<String, Position> positions() {
        return positions;
    }

    Optional<Position> position(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    List<Trade> trades() {
        return trades;
    }

    List<EquityPoint> equityCurve() {
        return equityCurve;
    }

    double cash() {
        return cash;
    }

    double equity(Map<String, Double> prices) {
        double equity = cash;
        for (Position position : positions.values()) {
            double price = prices.getOrDefault(position.getSymbol(), position.getEntryPrice());
            equity += position.marketValue(price);
        }
        return equity;
    }

    void recordEquity(Instant time, Map<String, Double> prices) {
        equityCurve.add(new EquityPoint(time, equity(prices)));
    }

    /**
     * Opens a position sized as {@code positionRatio} of current equity. Returns empty when a risk
     * limit or the available cash prevents the entry.
     */
    Optional<Position> open(
            String symbol,
            PositionSide side,
            double price,
            Instant time,
            RiskProperties risk,
            double positionRatio,
            Map<String, Double> prices
    ) {
        if (positions.containsKey(symbol) || positions.size() >= risk.maxPositions()) {
            return Optional.empty();
        }
        double equity = equity(prices);
        rollDailyLoss(time);
        if (risk.dailyLossLimitPercent() != null && dailyLoss / equity * 100.0 >= risk.dailyLossLimitPercent()) {
            log.debug("event=daily_loss_limit symbol={} daily_loss={}", symbol, dailyLoss);
            return Optional.empty();
        }

        double spend = equity * positionRatio;
        if (spend < risk.minOrderUsdt() || spend > cash) {
            return Optional.empty();
        }

        double execPrice = side == PositionSide.LONG ? adverseBuy(price) : adverseSell(price);
        double fee = spend * costs.feeRate();
        double net = spend - fee;
        double quantity = net / execPrice;
        double margin = side == PositionSide.SHORT ? net : 0.0;

        cash -= spend;
        Position position = new Position(symbol, side, time, execPrice, quantity, spend, margin, risk);
        positions.put(symbol, position);
        log.debug("event=position_opened symbol={} side={} price={} quantity={} cost={}",
                symbol, side, execPrice, quantity, spend);
        return Optional.of(position);
    }

    Optional<Trade> close(String symbol, double price, Instant time, ExitReason reason) {
        Position position = positions.remove(symbol);
        if (position == null) {
            return Optional.empty();
        }

        double execPrice;
        double proceeds;
        if (position.getSide() == PositionSide.LONG) {
            execPrice = adverseSell(price);
            double gross = position.getQuantity() * execPrice;
            proceeds = gross - gross * costs.feeRate();
        } else {
            execPrice = adverseBuy(price);
            double gross = position.getQuantity() * execPrice;
            double pnl = (position.getEntryPrice() - execPrice) * position.getQuantity() - gross * costs.feeRate();
            proceeds = Math.max(0.0, position.getMargin() + pnl);
        }
        double pnl = proceeds - position.getCost();

        rollDailyLoss(time);
        if (pnl < 0) {
            dailyLoss += Math.abs(pnl);
        }
        cash += proceeds;

        Trade trade = new Trade(
                symbol,
                position.getSide(),
                position.getEntryTime(),
                time,
                position.getEntryPrice(),
                execPrice,
                position.getQuantity(),
                position.getCost(),
                proceeds,
                pnl,
                reason
        );
        trades.add(trade);
        log.debug("event=position_closed symbol={} side={} reason={} pnl={}",
                symbol, position.getSide(), reason.code(), pnl);
        return Optional.of(trade);
    }

    double adverseBuy(double price) {
        return price * (1 + costs.slippagePercent() / 100.0) * (1 + costs.spreadBps() / 20_000.0);
    }

    double adverseSell(double price) {
        return price * (1 - costs.slippagePercent() / 100.0) * (1 - costs.spreadBps() / 20_000.0);
    }

    private void rollDailyLoss(Instant time) {
        LocalDate date = time.atZone(ZoneOffset.UTC).toLocalDate();
        if (!date.equals(lossDate)) {
            lossDate = date;
            dailyLoss = 0.0;
        }
    }
}
