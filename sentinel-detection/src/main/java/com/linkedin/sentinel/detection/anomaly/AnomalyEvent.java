/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.anomaly;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.detection.baseline.Baseline;
import com.linkedin.sentinel.detection.detector.DetectorKind;
import com.linkedin.sentinel.detection.telemetry.MetricKind;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;


/**
 * An anomaly detected on one telemetry event. Instances are immutable and are handed to the delivery collaborator
 * as is, or as the JSON produced by {@link #toJson()}.
 */
public final class AnomalyEvent {
  public static final double MAX_CONFIDENCE = 0.99;
  private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

  private final String _anomalyId;
  private final long _detectionTimeMs;
  private final String _eventId;
  private final long _eventTimestampMs;
  private final String _service;
  private final String _model;
  private final String _metric;
  private final AnomalyType _anomalyType;
  private final Severity _severity;
  private final double _confidence;
  private final DetectorKind _detectionMethod;
  private final double _value;
  private final Baseline _baseline;
  private final AnomalyDetails _details;
  private final Map<String, String> _context;
  private final String _rootCause;
  private final List<String> _remediation;

  private AnomalyEvent(Builder builder) {
    TelemetryEvent event = builder._event;
    _anomalyId = UUID.randomUUID().toString();
    _detectionTimeMs = builder._detectionTimeMs;
    _eventId = event.eventId();
    _eventTimestampMs = event.timestampMs();
    _service = event.service();
    _model = event.model();
    _metric = event.metric();
    _anomalyType = builder._anomalyType;
    _severity = builder._severity;
    _confidence = builder._confidence;
    _detectionMethod = builder._detectionMethod;
    _value = event.value();
    _baseline = builder._baseline;
    _details = builder._details;
    _context = Collections.unmodifiableMap(builder._context);
    _rootCause = builder._rootCause;
    _remediation = List.copyOf(builder._remediation);
  }

  public String anomalyId() {
    return _anomalyId;
  }

  public long detectionTimeMs() {
    return _detectionTimeMs;
  }

  /**
   * @return Id of the telemetry event the anomaly was detected on.
   */
  public String eventId() {
    return _eventId;
  }

  public long eventTimestampMs() {
    return _eventTimestampMs;
  }

  public String service() {
    return _service;
  }

  public String model() {
    return _model;
  }

  public String metric() {
    return _metric;
  }

  public AnomalyType anomalyType() {
    return _anomalyType;
  }

  public Severity severity() {
    return _severity;
  }

  /**
   * @return Confidence in [0.0, {@link #MAX_CONFIDENCE}].
   */
  public double confidence() {
    return _confidence;
  }

  public DetectorKind detectionMethod() {
    return _detectionMethod;
  }

  /**
   * @return The observed value.
   */
  public double value() {
    return _value;
  }

  /**
   * @return The baseline the decision was made against.
   */
  public Baseline baseline() {
    return _baseline;
  }

  public AnomalyDetails details() {
    return _details;
  }

  /**
   * @return Trace id, user id and region of the event when it carried them, and the baseline sample count.
   */
  public Map<String, String> context() {
    return _context;
  }

  public String rootCause() {
    return _rootCause;
  }

  public List<String> remediation() {
    return _remediation;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("anomalyId", _anomalyId);
    structure.put("detectionTimeMs", _detectionTimeMs);
    structure.put("eventId", _eventId);
    structure.put("eventTimestampMs", _eventTimestampMs);
    structure.put("service", _service);
    structure.put("model", _model);
    structure.put("metric", _metric);
    structure.put("anomalyType", _anomalyType.name());
    structure.put("severity", _severity.name());
    structure.put("confidence", _confidence);
    structure.put("detectionMethod", _detectionMethod.detectorName());
    structure.put("value", _value);
    structure.put("baseline", _baseline.getJsonStructure());
    structure.put("details", _details.getJsonStructure());
    structure.put("context", _context);
    if (_rootCause != null) {
      structure.put("rootCause", _rootCause);
    }
    structure.put("remediation", _remediation);
    return structure;
  }

  /**
   * @return JSON representation of this anomaly.
   */
  public String toJson() {
    return GSON.toJson(getJsonStructure());
  }

  @Override
  public String toString() {
    return String.format("{%s %s on %s/%s/%s by %s: value=%.3f, confidence=%.3f, details=%s}", _severity, _anomalyType,
                         _service, _model, _metric, _detectionMethod, _value, _confidence, _details);
  }

  public static class Builder {
    // Required parameters
    private final TelemetryEvent _event;
    private final DetectorKind _detectionMethod;
    private final Baseline _baseline;
    // Optional parameters - initialized to default values
    private AnomalyType _anomalyType;
    private Severity _severity = Severity.MEDIUM;
    private double _confidence = 0.5;
    private AnomalyDetails _details;
    private long _detectionTimeMs = System.currentTimeMillis();
    private final Map<String, String> _context = new LinkedHashMap<>();
    private String _rootCause = null;
    private final List<String> _remediation = new ArrayList<>();

    /**
     * The anomaly type defaults to the type of the metric of the event, the remediation to the hints of that type.
     *
     * @param event The telemetry event the anomaly was detected on.
     * @param detectionMethod The detector that found the anomaly.
     * @param baseline The baseline the decision was made against.
     */
    public Builder(TelemetryEvent event, DetectorKind detectionMethod, Baseline baseline) {
      _event = Utils.validateNotNull(event, "Telemetry event cannot be null.");
      _detectionMethod = Utils.validateNotNull(detectionMethod, "Detection method cannot be null.");
      _baseline = Utils.validateNotNull(baseline, "Baseline cannot be null.");
      _anomalyType = MetricKind.anomalyTypeFor(event.metric());
      _details = new AnomalyDetails(baseline.mean(), baseline.mean(), 0.0);
      copyTag(TelemetryEvent.TRACE_ID_TAG);
      copyTag(TelemetryEvent.USER_ID_TAG);
      copyTag(TelemetryEvent.REGION_TAG);
      _context.put("sample_count", Integer.toString(baseline.sampleCount()));
    }

    private void copyTag(String tag) {
      String value = _event.tag(tag);
      if (value != null) {
        _context.put(tag, value);
      }
    }

    /**
     * (Optional) Override the anomaly type derived from the metric.
     * @param anomalyType Anomaly type.
     * @return this builder.
     */
    public Builder anomalyType(AnomalyType anomalyType) {
      _anomalyType = Utils.validateNotNull(anomalyType, "Anomaly type cannot be null.");
      return this;
    }

    public Builder severity(Severity severity) {
      _severity = Utils.validateNotNull(severity, "Severity cannot be null.");
      return this;
    }

    /**
     * @param confidence Confidence in [0.0, {@link #MAX_CONFIDENCE}].
     * @return this builder.
     */
    public Builder confidence(double confidence) {
      if (!(confidence >= 0.0 && confidence <= MAX_CONFIDENCE)) {
        throw new IllegalArgumentException(String.format("Confidence must be in [0.0, %.2f] (%f).", MAX_CONFIDENCE, confidence));
      }
      _confidence = confidence;
      return this;
    }

    public Builder details(AnomalyDetails details) {
      _details = Utils.validateNotNull(details, "Anomaly details cannot be null.");
      return this;
    }

    public Builder detectionTimeMs(long detectionTimeMs) {
      _detectionTimeMs = detectionTimeMs;
      return this;
    }

    public Builder rootCause(String rootCause) {
      _rootCause = rootCause;
      return this;
    }

    /**
     * (Optional) Add a remediation hint. Without any, the hints of the anomaly type are used.
     * @param remediation Remediation hint.
     * @return this builder.
     */
    public Builder remediation(String remediation) {
      _remediation.add(Utils.validateNotNull(remediation, "Remediation cannot be null."));
      return this;
    }

    public AnomalyEvent build() {
      if (_remediation.isEmpty()) {
        _remediation.addAll(_anomalyType.remediation());
      }
      return new AnomalyEvent(this);
    }
  }
}
