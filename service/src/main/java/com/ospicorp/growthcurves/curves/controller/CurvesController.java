package com.ospicorp.growthcurves.curves.controller;

import com.ospicorp.growthcurves.curves.model.BandMode;
import com.ospicorp.growthcurves.curves.model.BandPoint;
import com.ospicorp.growthcurves.curves.model.DetectionRequest;
import com.ospicorp.growthcurves.curves.model.InvalidParameterException;
import com.ospicorp.growthcurves.curves.model.LogPhaseRangeRequest;
import com.ospicorp.growthcurves.curves.model.LogPhaseSelection;
import com.ospicorp.growthcurves.curves.model.SampleInput;
import com.ospicorp.growthcurves.curves.model.SampleParameters;
import com.ospicorp.growthcurves.curves.model.SampleSelectionRequest;
import com.ospicorp.growthcurves.curves.model.SmoothedCurvesPayload;
import com.ospicorp.growthcurves.curves.model.SmoothingRequest;
import com.ospicorp.growthcurves.curves.model.UncertaintyBand;
import com.ospicorp.growthcurves.curves.service.CurveWorkspace;
import com.ospicorp.growthcurves.curves.service.SmoothingReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Curves")
public class CurvesController {
  private static final Logger log = LoggerFactory.getLogger(CurvesController.class);
  private static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");

  private final CurveWorkspace workspace;

  public CurvesController(CurveWorkspace workspace) {
    this.workspace = workspace;
  }

  @PutMapping("/workspace")
  @Operation(summary = "Load samples",
      description = "Replace the workspace with the given samples; "
          + "each starts with a raw history entry.")
  public ResponseEntity<Map<String, Object>> load(@RequestBody @Valid List<SampleInput> samples) {
    workspace.load(samples);
    return ResponseEntity.ok(Map.of("samples", workspace.sampleNames()));
  }

  @GetMapping("/workspace")
  @Operation(summary = "Export smoothed curves",
      description = "Samples with their smoothing histories and log-phase selections.")
  public SmoothedCurvesPayload export() {
    return workspace.export();
  }

  @PostMapping("/workspace/smoothing")
  @Tag(name = "Smoothing")
  @Operation(summary = "Apply LOESS",
      description = "Smooth the raw points of the given samples (all when omitted) "
          + "and append the result to their history.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Batch report",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SmoothingReport.class))),
      @ApiResponse(responseCode = "400", description = "Invalid smoothing parameters"),
      @ApiResponse(responseCode = "404", description = "Unknown sample",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SmoothingReport applySmoothing(@RequestBody SmoothingRequest request) {
    return workspace.applySmoothing(request.samples(), request.toParameters(),
        (sample, done, total) -> log.debug("LOESS progress {}/{} ({})", done, total, sample));
  }

  @PostMapping("/workspace/step-back")
  @Tag(name = "Smoothing")
  @Operation(summary = "Undo smoothing",
      description = "Drop the newest history entry of the given samples; "
          + "the raw entry is never removed.")
  public SmoothingReport stepBack(@RequestBody(required = false) SampleSelectionRequest request) {
    return workspace.stepBack(request == null ? null : request.samples());
  }

  @PostMapping("/workspace/log-phases/detect")
  @Tag(name = "Log phase")
  @Operation(summary = "Detect log phases",
      description = "Re-run automatic log-phase detection; out-of-range thresholds are clamped.")
  public Map<String, Object> detect(@RequestBody(required = false) DetectionRequest request) {
    DetectionRequest effective = request != null
        ? request
        : new DetectionRequest(null, null, null, null, null, null, null);
    int detected = workspace.detectLogPhases(effective.samples(),
        effective.toOptions(workspace.detectionOptions()));
    return Map.of("detected", detected, "options", workspace.detectionOptions());
  }

  @GetMapping("/samples/{sample}/log-phase")
  @Tag(name = "Log phase")
  @Operation(summary = "Get log phase")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Selection",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = LogPhaseSelection.class))),
      @ApiResponse(responseCode = "204", description = "No selection"),
      @ApiResponse(responseCode = "404", description = "Unknown sample",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<LogPhaseSelection> logPhase(@PathVariable String sample) {
    return workspace.logPhase(sample)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @PutMapping("/samples/{sample}/log-phase")
  @Tag(name = "Log phase")
  @Operation(summary = "Select log phase manually")
  public LogPhaseSelection selectLogPhase(@PathVariable String sample,
      @RequestBody @Valid LogPhaseRangeRequest range) {
    return workspace.selectLogPhase(sample, range.start(), range.end());
  }

  @DeleteMapping("/samples/{sample}/log-phase")
  @Tag(name = "Log phase")
  @Operation(summary = "Remove log phase")
  public ResponseEntity<Void> clearLogPhase(@PathVariable String sample) {
    workspace.clearLogPhase(sample);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/samples/{sample}/parameters")
  @Tag(name = "Growth parameters")
  @Operation(summary = "Growth parameters",
      description = "Per-well growth rate, doubling time, lag and capacity, summarized across "
          + "replicate wells with t and bootstrap confidence intervals.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Parameters",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SampleParameters.class))),
      @ApiResponse(responseCode = "404", description = "Unknown sample",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SampleParameters parameters(@PathVariable String sample) {
    return workspace.parameters(sample);
  }

  @GetMapping("/samples/{sample}/band")
  @Tag(name = "Uncertainty")
  @Operation(summary = "Uncertainty band",
      description = "Bootstrap confidence band over the sample's replicate wells.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Band",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = UncertaintyBand.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "204", description = "Band unavailable (fewer than two wells)"),
      @ApiResponse(responseCode = "404", description = "Unknown sample",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> band(@PathVariable String sample,
      @RequestParam(defaultValue = "pointwise")
          @Parameter(description = "none, pointwise or simultaneous") String mode,
      @RequestParam(required = false) Double span,
      @RequestParam(required = false) Integer degree,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    BandMode bandMode = parseMode(mode);
    MediaType contentType = selectMediaType(format, accept);
    Optional<UncertaintyBand> band = workspace.band(sample, bandMode, span, degree);
    if (band.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    List<BandPoint> points = band.get().points();
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? points : band.get();
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static BandMode parseMode(String value) {
    try {
      return BandMode.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException(
          "Invalid band mode. Supported values: none,pointwise,simultaneous.", 1106);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          1109);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
