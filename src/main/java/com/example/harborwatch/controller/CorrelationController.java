package com.example.harborwatch.controller;

import com.example.harborwatch.config.CalibrationFrameCatalog;
import com.example.harborwatch.model.BoundingBox;
import com.example.harborwatch.model.ClassifiedTarget;
import com.example.harborwatch.model.CorrelationReport;
import com.example.harborwatch.model.Detection;
import com.example.harborwatch.model.MatchResult;
import com.example.harborwatch.model.RegistryEntry;
import com.example.harborwatch.model.api.CorrelationRequest;
import com.example.harborwatch.model.api.CorrelationResponse;
import com.example.harborwatch.model.api.DetectionRequest;
import com.example.harborwatch.model.api.FrameResponse;
import com.example.harborwatch.model.api.RegistryResponse;
import com.example.harborwatch.model.api.TargetResponse;
import com.example.harborwatch.registry.RegistrySnapshot;
import com.example.harborwatch.service.CorrelationCommand;
import com.example.harborwatch.service.CorrelationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Correlation", description = "Match imagery detections against the vessel registry")
public class CorrelationController {

    private final CorrelationService service;

    public CorrelationController(CorrelationService service) {
        this.service = service;
    }

    @Operation(
            summary = "Classify detections as legal or dark ships",
            description = "Geolocates each bounding box through the calibration frame and matches it to the nearest "
                    + "registry entry inside the tolerance radius. Unmatched detections are reported as dark ships.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Correlation pass completed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CorrelationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or calibration; the pass did not run", content = @Content),
            @ApiResponse(responseCode = "404", description = "Unknown calibration frame", content = @Content)
    })
    @PostMapping(value = "/correlations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CorrelationResponse> correlate(@Valid @RequestBody CorrelationRequest request) {
        CorrelationCommand command = new CorrelationCommand(
                request.frame(),
                request.calibration() != null ? request.calibration().toFrame() : null,
                request.toleranceMeters(),
                toDetections(request.detections()),
                request.registry());
        return ResponseEntity.ok(toResponse(service.run(command)));
    }

    @GetMapping("/frames")
    @Operation(summary = "List configured calibration frames")
    public ResponseEntity<List<FrameResponse>> frames() {
        CalibrationFrameCatalog catalog = service.frameCatalog();
        String defaultName = catalog.hasDefault() ? catalog.defaultFrameName() : null;
        List<FrameResponse> frames = catalog.frames().entrySet().stream()
                .map(entry -> new FrameResponse(
                        entry.getKey(),
                        entry.getValue().north(),
                        entry.getValue().south(),
                        entry.getValue().west(),
                        entry.getValue().east(),
                        entry.getValue().imageWidth(),
                        entry.getValue().imageHeight(),
                        entry.getKey().equals(defaultName)))
                .collect(Collectors.toList());
        return ResponseEntity.ok(frames);
    }

    @GetMapping("/registry")
    @Operation(summary = "Show the configured vessel registry")
    public ResponseEntity<RegistryResponse> registry() {
        RegistrySnapshot snapshot = service.configuredRegistry();
        return ResponseEntity.ok(new RegistryResponse(snapshot.entries(), snapshot.skipped()));
    }

    private List<Detection> toDetections(List<DetectionRequest> requests) {
        List<Detection> detections = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            DetectionRequest request = requests.get(i);
            String id = request.id() != null && !request.id().isBlank() ? request.id() : "det-" + (i + 1);
            List<Double> bbox = request.bbox();
            detections.add(new Detection(id, new BoundingBox(bbox.get(0), bbox.get(1), bbox.get(2), bbox.get(3))));
        }
        return detections;
    }

    private CorrelationResponse toResponse(CorrelationReport report) {
        List<TargetResponse> targets = report.targets().stream()
                .map(this::toTargetResponse)
                .collect(Collectors.toList());
        return new CorrelationResponse(
                report.frameName(),
                report.toleranceMeters(),
                targets.size(),
                report.legalCount(),
                report.darkCount(),
                targets,
                report.skippedRecords(),
                report.elapsedMs());
    }

    private TargetResponse toTargetResponse(ClassifiedTarget target) {
        MatchResult result = target.result();
        BoundingBox box = result.detection().boundingBox();
        return new TargetResponse(
                result.detection().id(),
                List.of(box.x1(), box.y1(), box.x2(), box.y2()),
                result.derivedPosition().lat(),
                result.derivedPosition().lon(),
                result.status(),
                target.classification().label(),
                target.classification().colorHint(),
                result.match().map(RegistryEntry::id).orElse(null),
                result.match().map(RegistryEntry::name).orElse(null),
                result.distanceMeters());
    }
}
