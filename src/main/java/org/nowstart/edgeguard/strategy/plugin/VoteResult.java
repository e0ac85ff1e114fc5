package org.nowstart.edgeguard.strategy.plugin;

import java.util.List;
import org.nowstart.edgeguard.data.type.SignalType;

/**
 * Ensemble outcome. Scores are sums of normalized member weights per direction.
 *
 * @param confidence score of the winning direction, {@code 0} when nothing won
 * @param unanimous  every member voted the same direction; all abstaining counts as unanimous
 */
public record VoteResult(
        SignalType signal,
        List<StrategyVote> votes,
        double buyScore,
        double sellScore,
        double shortScore,
        double coverScore,
        double confidence,
        boolean unanimous
) {

    public static final VoteResult EMPTY = new VoteResult(SignalType.NONE, List.of(), 0, 0, 0, 0, 0, true);

    public VoteResult {
        votes = List.copyOf(votes);
    }

    public double scoreFor(SignalType type) {
        return switch (type) {
            case BUY -> buyScore;
            case SELL -> sellScore;
            case SHORT -> shortScore;
            case COVER -> coverScore;
            case NONE -> 0.0;
        };
    }
}
