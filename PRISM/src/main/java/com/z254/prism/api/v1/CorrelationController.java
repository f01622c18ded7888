package com.z254.prism.api.v1;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.AlertNoiseReport;
import com.z254.prism.correlation.AlertNoiseScorer;
import com.z254.prism.correlation.ChangeCorrelationEngine;
import com.z254.prism.correlation.ChangeCorrelationReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST API controller for change to alert spike correlation and alert noise scoring.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/correlation")
@Tag(name = "Correlation", description = "Change to alert spike correlation and alert noise")
public class CorrelationController {

    private final ChangeCorrelationEngine correlationEngine;
    private final AlertNoiseScorer noiseScorer;
    private final PrismProperties prismProperties;

    public CorrelationController(ChangeCorrelationEngine correlationEngine,
                                 AlertNoiseScorer noiseScorer,
                                 PrismProperties prismProperties) {
        this.correlationEngine = correlationEngine;
        this.noiseScorer = noiseScorer;
        this.prismProperties = prismProperties;
    }

    @GetMapping("/changes")
    @Operation(summary = "Correlate changes",
            description = "Match configuration changes to alert spikes that follow them")
    public Mono<ResponseEntity<ChangeCorrelationReport>> correlateChanges(
            @Parameter(description = "Hours to look back")
            @RequestParam(required = false) Integer hoursBack,
            @Parameter(description = "Minutes after a change in which a spike counts as correlated")
            @RequestParam(required = false) Integer windowMinutes) {

        PrismProperties.Correlation config = prismProperties.getCorrelation();
        int hours = hoursBack != null ? hoursBack : config.getDefaultHoursBack();
        int window = windowMinutes != null ? windowMinutes : config.getDefaultWindowMinutes();

        return correlationEngine.correlate(hours, window)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/noise")
    @Operation(summary = "Score alert noise",
            description = "Entropy, flapping and repeat analysis of recent alerts")
    public Mono<ResponseEntity<AlertNoiseReport>> scoreNoise(
            @Parameter(description = "Hours to look back")
            @RequestParam(required = false) Integer hoursBack,
            @Parameter(description = "Only alerts from devices whose name contains this value")
            @RequestParam(required = false) String device,
            @Parameter(description = "Only alerts from this device group")
            @RequestParam(required = false) Long groupId) {

        int hours = hoursBack != null ? hoursBack : prismProperties.getNoise().getDefaultHoursBack();

        return noiseScorer.score(hours, device, groupId)
                .map(ResponseEntity::ok);
    }
}
