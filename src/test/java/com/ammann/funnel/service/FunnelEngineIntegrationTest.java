/* (C)2026 */
package com.ammann.funnel.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.funnel.dto.FunnelAnalysisDTO;
import com.ammann.funnel.dto.FunnelResultDTO;
import com.ammann.funnel.model.BreakdownDimension;
import com.ammann.funnel.model.BreakdownSpec;
import com.ammann.funnel.model.ConversionWindow;
import com.ammann.funnel.model.CorrelationSpec;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.source.InMemoryEventSource;
import com.ammann.funnel.support.JourneyFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class FunnelEngineIntegrationTest {

    private static final FunnelSpec BROWSER_FUNNEL = FunnelSpec.builder()
            .events("$pageview", "sign up", "buy")
            .window(ConversionWindow.days(7))
            .build();

    @Inject FunnelEngine engine;

    @Inject BreakdownResolver breakdownResolver;

    @Inject MeterRegistry meterRegistry;

    private static InMemoryEventSource browsers() {
        return new InMemoryEventSource(JourneyFixtures.load("browser-journeys.json"));
    }

    @Test
    void configuredBreakdownLimitIsApplied() {
        assertThat(breakdownResolver.effectiveLimit(null)).isEqualTo(25);
        assertThat(breakdownResolver.effectiveLimit(BreakdownSpec.of(BreakdownDimension.actor("$os")).withLimit(3)))
                .isEqualTo(3);
    }

    @Test
    void computesStepsOnTheManagedExecutor() {
        List<FunnelResultDTO> results = engine.computeSteps(browsers(), BROWSER_FUNNEL);

        assertThat(results.get(0).counts()).containsExactly(7L, 4L, 2L);
    }

    @Test
    void analysisWithBreakdownAndCorrelation() {
        FunnelSpec byBrowser = BROWSER_FUNNEL.toBuilder()
                .breakdown(BreakdownSpec.of(BreakdownDimension.actor("$browser")))
                .build();

        FunnelAnalysisDTO analysis = engine.analyze(browsers(), byBrowser, CorrelationSpec.properties("$browser"));

        assertThat(analysis.steps()).extracting(FunnelResultDTO::breakdownValue)
                .containsExactly(List.of("Chrome"), List.of("Safari"), List.of("$$_undefined"), List.of("Firefox"));
        assertThat(analysis.correlation().successTotal()).isEqualTo(2);
        assertThat(analysis.actorsProcessed()).isEqualTo(7);
    }

    @Test
    void registersComputationMeters() {
        engine.computeSteps(browsers(), BROWSER_FUNNEL);

        assertThat(meterRegistry.find("funnel_computations_total").tag("viz", "steps").counter())
                .isNotNull();
        assertThat(meterRegistry.find("funnel_computation_seconds").timer()).isNotNull();
    }
}
