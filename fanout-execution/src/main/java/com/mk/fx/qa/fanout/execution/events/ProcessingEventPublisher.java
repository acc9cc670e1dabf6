package com.mk.fx.qa.fanout.execution.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mk.fx.qa.fanout.execution.cfg.ObjectMapperConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes processing events as single-line JSON log records. Publishing never throws: an event
 * that cannot be serialised is logged through its {@code toString()}.
 */
@Slf4j
@Component
public class ProcessingEventPublisher {

  private final ObjectWriter writer;

  public ProcessingEventPublisher() {
    this(ObjectMapperConfig.createMapper());
  }

  public ProcessingEventPublisher(ObjectMapper mapper) {
    this.writer = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
  }

  /** Publishes the timing of one sub-fetch attempt. */
  public void publishApiCall(ApiCallEvent event) {
    if (log.isDebugEnabled()) {
      log.debug(render(event));
    }
  }

  /** Publishes a sub-fetch error. */
  public void publishApiError(ApiErrorEvent event) {
    log.error(render(event));
  }

  /** Publishes a unit that resolved to a timeout or processing failure. */
  public void publishUnitFailure(UnitFailureEvent event) {
    log.error(render(event));
  }

  /** Publishes the aggregate metrics of a completed batch. */
  public void publishPerformanceMetrics(PerformanceMetricsEvent event) {
    log.info(render(event));
  }

  /** Publishes a batch-level failure. */
  public void publishBatchFailure(BatchFailureEvent event) {
    log.error(render(event));
  }

  String render(ProcessingEvent event) {
    try {
      return writer.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      return String.valueOf(event);
    }
  }
}
