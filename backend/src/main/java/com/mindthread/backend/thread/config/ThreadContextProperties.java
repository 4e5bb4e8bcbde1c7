package com.mindthread.backend.thread.config;

import com.mindthread.backend.thread.domain.RelationAxis;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.thread")
public class ThreadContextProperties {

  @Valid private MotionBudget motionBudget = new MotionBudget();
  @Valid private Executor executor = new Executor();
  @Valid private Store store = new Store();

  private Duration buildTimeout = Duration.ofSeconds(2);

  @NotNull private FailurePolicy failurePolicy = FailurePolicy.PARTIAL;

  public MotionBudget getMotionBudget() {
    return motionBudget;
  }

  public void setMotionBudget(MotionBudget motionBudget) {
    this.motionBudget = motionBudget;
  }

  public Executor getExecutor() {
    return executor;
  }

  public void setExecutor(Executor executor) {
    this.executor = executor;
  }

  public Store getStore() {
    return store;
  }

  public void setStore(Store store) {
    this.store = store;
  }

  public Duration getBuildTimeout() {
    return buildTimeout;
  }

  public void setBuildTimeout(Duration buildTimeout) {
    if (buildTimeout != null && !buildTimeout.isNegative() && !buildTimeout.isZero()) {
      this.buildTimeout = buildTimeout;
    }
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  public void setFailurePolicy(FailurePolicy failurePolicy) {
    this.failurePolicy = failurePolicy;
  }

  public enum FailurePolicy {
    /** Keep the axes that resolved and report the failed ones in the context metadata. */
    PARTIAL,
    /** Abort the whole build as soon as one axis fails. */
    FAIL_FAST
  }

  public enum StoreBackend {
    JDBC,
    MEMORY
  }

  /** Per-axis node caps. */
  public static class MotionBudget {

    @Min(1)
    @Max(50)
    private int maxUpstreamNodes = 5;

    @Min(1)
    @Max(50)
    private int maxDownstreamNodes = 5;

    @Min(1)
    @Max(50)
    private int maxLateralNodes = 8;

    public int getMaxUpstreamNodes() {
      return maxUpstreamNodes;
    }

    public void setMaxUpstreamNodes(int maxUpstreamNodes) {
      this.maxUpstreamNodes = maxUpstreamNodes;
    }

    public int getMaxDownstreamNodes() {
      return maxDownstreamNodes;
    }

    public void setMaxDownstreamNodes(int maxDownstreamNodes) {
      this.maxDownstreamNodes = maxDownstreamNodes;
    }

    public int getMaxLateralNodes() {
      return maxLateralNodes;
    }

    public void setMaxLateralNodes(int maxLateralNodes) {
      this.maxLateralNodes = maxLateralNodes;
    }

    public int limitFor(RelationAxis axis) {
      return switch (axis) {
        case UPSTREAM -> maxUpstreamNodes;
        case DOWNSTREAM -> maxDownstreamNodes;
        case LATERAL -> maxLateralNodes;
      };
    }
  }

  public static class Executor {

    @Min(1)
    private int maxConcurrency = 6;

    public int getMaxConcurrency() {
      return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = Math.max(1, maxConcurrency);
    }
  }

  public static class Store {

    @NotNull private StoreBackend backend = StoreBackend.JDBC;

    /** JSON seed loaded into the in-memory backend at startup; ignored by the JDBC backend. */
    private String seedLocation;

    public StoreBackend getBackend() {
      return backend;
    }

    public void setBackend(StoreBackend backend) {
      this.backend = backend;
    }

    public String getSeedLocation() {
      return seedLocation;
    }

    public void setSeedLocation(String seedLocation) {
      this.seedLocation = seedLocation;
    }
  }
}
