package org.nowstart.edgeguard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mockStatic;

import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.nowstart.edgeguard.backtest.runner.BacktestRunner;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.property.ValidationProperties;
import org.nowstart.edgeguard.strategy.StrategyRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class ApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void context_bindsTradingPropertiesFromApplicationYaml() {
        TradingProperties trading = context.getBean(TradingProperties.class);

        assertThat(trading.strategyId()).isEqualTo(TradingProperties.DEFAULT_STRATEGY_ID);
        assertThat(trading.risk().positionRatio()).isEqualTo(0.2);
        assertThat(trading.risk().maxPositions()).isEqualTo(3);
        assertThat(trading.risk().correlation().enabled()).isFalse();
        assertThat(trading.risk().correlation().threshold()).isEqualTo(0.7);
        assertThat(trading.costs().feeRate()).isEqualTo(0.001);
        assertThat(context.getBean(ValidationProperties.class).walkForwardFolds()).isEqualTo(5);
    }

    @Test
    void context_registersBuiltInStrategiesAndLeavesRunnerOff() {
        assertThat(context.getBean(StrategyRegistry.class).registeredIds())
                .contains("default", "rsi-reversal", "breakout");
        assertThat(context.getBeansOfType(BacktestRunner.class)).isEmpty();
    }

    @Test
    void main_invokesSpringApplicationRun() {
        String[] args = {"--spring.main.banner-mode=off"};

        try (MockedStatic<SpringApplication> springApplication = mockStatic(SpringApplication.class)) {
            Application.main(args);
            springApplication.verify(() -> SpringApplication.run(Application.class, args));
        }
    }
}
