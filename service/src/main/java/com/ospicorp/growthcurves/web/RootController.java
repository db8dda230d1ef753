package com.ospicorp.growthcurves.web;

import com.ospicorp.growthcurves.curves.service.CurveWorkspace;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  private final CurveWorkspace workspace;

  public RootController(CurveWorkspace workspace) {
    this.workspace = workspace;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "growth-curves");
    body.put("status", "ok");
    body.put("samples", workspace.sampleNames().size());
    body.put("smoothing", workspace.lastParameters());
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
