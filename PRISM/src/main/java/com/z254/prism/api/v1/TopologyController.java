package com.z254.prism.api.v1;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.topology.BlastRadiusAnalyzer;
import com.z254.prism.topology.BlastRadiusReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST API controller for topology impact analysis.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/topology")
@Tag(name = "Topology", description = "Blast radius analysis")
public class TopologyController {

    private final BlastRadiusAnalyzer blastRadiusAnalyzer;
    private final PrismProperties prismProperties;

    public TopologyController(BlastRadiusAnalyzer blastRadiusAnalyzer, PrismProperties prismProperties) {
        this.blastRadiusAnalyzer = blastRadiusAnalyzer;
        this.prismProperties = prismProperties;
    }

    @GetMapping("/devices/{deviceId}/blast-radius")
    @Operation(summary = "Analyze blast radius",
            description = "Score the impact of a device failure over its neighbors; depth is clamped to 1-3")
    public Mono<ResponseEntity<BlastRadiusReport>> analyzeBlastRadius(
            @PathVariable long deviceId,
            @Parameter(description = "Traversal depth")
            @RequestParam(required = false) Integer depth) {

        int requested = depth != null ? depth : prismProperties.getTopology().getDefaultDepth();
        log.info("Blast radius requested: deviceId={}, depth={}", deviceId, requested);

        return blastRadiusAnalyzer.analyze(deviceId, requested)
                .map(ResponseEntity::ok);
    }
}
