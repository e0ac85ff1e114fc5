package org.nowstart.edgeguard.service.signal;

import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.dto.MacdValues;

final class IndicatorSnapshots {

    private IndicatorSnapshots() {
    }

    static IndicatorSnapshot of(double price, double maShort, double maLong, double prevMaShort, double prevMaLong, double rsi) {
        return new IndicatorSnapshot(
                price, 100, 100, maShort, maLong, prevMaShort, prevMaLong, rsi,
                null, null, null, null, null, null, null
        );
    }

    static IndicatorSnapshot withMacd(MacdValues macd) {
        return new IndicatorSnapshot(
                100, 100, 100, 10, 10, 10, 10, 50,
                macd, null, null, null, null, null, null
        );
    }

    static IndicatorSnapshot withVolume(double volume, double avgVolume) {
        return new IndicatorSnapshot(
                100, volume, avgVolume, 10, 10, 10, 10, 50,
                null, null, null, null, null, null, null
        );
    }
}
