package org.nowstart.edgeguard.data.dto;

import java.util.List;
import org.nowstart.edgeguard.data.type.WalkForwardVerdict;

/**
 * @param consistency share of folds with a positive out-of-sample return (0..1)
 */
public record WalkForwardReport(
        List<WalkForwardFold> folds,
        double avgInSample,
        double avgOutOfSample,
        double consistency,
        boolean robust,
        WalkForwardVerdict verdict
) {

    public WalkForwardReport {
        folds = List.copyOf(folds);
    }
}
