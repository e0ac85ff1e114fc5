package org.nowstart.edgeguard.strategy.plugin;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.strategy.core.StrategyContext;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.nowstart.edgeguard.util.NumericSafety;

/**
 * Weighted vote over already resolved member strategies.
 *
 * <p>Weights are normalized by their total; a zero or negative total is clamped to 1. A member voting
 * {@code none} abstains. In unanimous mode every non-abstaining member must agree before the threshold
 * is checked.
 */
public class EnsembleStrategy implements TradingStrategy {

    public static final String ID = "ensemble";
    private static final List<SignalType> SCORED = List.of(SignalType.BUY, SignalType.SELL, SignalType.SHORT, SignalType.COVER);

    private final List<WeightedStrategy> members;
    private final double threshold;
    private final boolean unanimousMode;

    public EnsembleStrategy(List<WeightedStrategy> members, double threshold, boolean unanimousMode) {
        this.members = List.copyOf(members);
        this.threshold = threshold;
        this.unanimousMode = unanimousMode;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Weighted ensemble";
    }

    public List<WeightedStrategy> members() {
        return members;
    }

    @Override
    public SignalType populateSignal(StrategyContext context) {
        return vote(context).signal();
    }

    @Override
    public void onTradeClosed(Trade trade, StrategyContext context) {
        for (WeightedStrategy member : members) {
            member.strategy().onTradeClosed(trade, context);
        }
    }

    public VoteResult vote(StrategyContext context) {
        if (members.isEmpty()) {
            return VoteResult.EMPTY;
        }

        double totalWeight = members.stream().mapToDouble(WeightedStrategy::weight).sum();
        if (totalWeight <= 0) {
            totalWeight = 1.0;
        }

        Map<SignalType, Double> scores = new EnumMap<>(SignalType.class);
        List<StrategyVote> votes = new ArrayList<>(members.size());
        for (WeightedStrategy member : members) {
            SignalType signal = member.strategy().populateSignal(context);
            votes.add(new StrategyVote(member.strategy().id(), signal, member.weight()));
            if (signal != SignalType.NONE) {
                scores.merge(signal, NumericSafety.safeRatio(member.weight(), totalWeight), Double::sum);
            }
        }

        List<SignalType> nonAbstaining = votes.stream()
                .map(StrategyVote::signal)
                .filter(signal -> signal != SignalType.NONE)
                .toList();

        if (unanimousMode) {
            if (nonAbstaining.isEmpty()) {
                return result(SignalType.NONE, votes, scores, 0.0, true);
            }
            SignalType first = nonAbstaining.get(0);
            boolean agreed = nonAbstaining.stream().allMatch(signal -> signal == first);
            if (!agreed) {
                return result(SignalType.NONE, votes, scores, 0.0, false);
            }
            double score = scores.getOrDefault(first, 0.0);
            return result(score >= threshold ? first : SignalType.NONE, votes, scores, score, true);
        }

        double maxScore = 0.0;
        SignalType winner = SignalType.NONE;
        for (SignalType type : SCORED) {
            double score = scores.getOrDefault(type, 0.0);
            if (score > maxScore) {
                maxScore = score;
                winner = type;
            }
        }
        if (maxScore < threshold) {
            winner = SignalType.NONE;
        }

        boolean unanimous;
        if (nonAbstaining.isEmpty()) {
            unanimous = true;
        } else {
            SignalType first = nonAbstaining.get(0);
            unanimous = nonAbstaining.size() == votes.size() && nonAbstaining.stream().allMatch(signal -> signal == first);
        }
        return result(winner, votes, scores, winner == SignalType.NONE ? 0.0 : maxScore, unanimous);
    }

    private VoteResult result(
            SignalType signal,
            List<StrategyVote> votes,
            Map<SignalType, Double> scores,
            double confidence,
            boolean unanimous
    ) {
        return new VoteResult(
                signal,
                votes,
                scores.getOrDefault(SignalType.BUY, 0.0),
                scores.getOrDefault(SignalType.SELL, 0.0),
                scores.getOrDefault(SignalType.SHORT, 0.0),
                scores.getOrDefault(SignalType.COVER, 0.0),
                confidence,
                unanimous
        );
    }
}
