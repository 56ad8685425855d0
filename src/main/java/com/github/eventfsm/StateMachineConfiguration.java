package com.github.eventfsm;

/**
 * This class encapsulates all the configuration parameters for the EventedStateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. maxDrainWaves only bounds {@link EventedStateMachine#processAll()}. A single
 * {@link EventedStateMachine#process()} call always processes exactly one wave.<br>
 * 2. if not set, maxDrainWaves defaults to 1024 which is plenty for machines whose handlers don't
 * keep feeding events back to themselves.<br>
 * 
 * @author gaurav
 */
public final class StateMachineConfiguration {
  static final int defaultMaxDrainWaves = 1024;

  private final int maxDrainWaves;
  private final boolean warnOnOverwrite;
  private final boolean trackStatistics;

  public int getMaxDrainWaves() {
    return maxDrainWaves;
  }

  public boolean getWarnOnOverwrite() {
    return warnOnOverwrite;
  }

  public boolean getTrackStatistics() {
    return trackStatistics;
  }

  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(defaultMaxDrainWaves, true, true);
  }

  public final static class StateMachineConfigurationBuilder {
    private int maxDrainWaves = defaultMaxDrainWaves;
    private boolean warnOnOverwrite = true;
    private boolean trackStatistics = true;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder maxDrainWaves(final int maxDrainWaves) {
      this.maxDrainWaves = maxDrainWaves;
      return this;
    }

    public StateMachineConfigurationBuilder warnOnOverwrite(final boolean warnOnOverwrite) {
      this.warnOnOverwrite = warnOnOverwrite;
      return this;
    }

    public StateMachineConfigurationBuilder trackStatistics(final boolean trackStatistics) {
      this.trackStatistics = trackStatistics;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(maxDrainWaves, warnOnOverwrite, trackStatistics);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (maxDrainWaves <= 0) {
      messages.append("maxDrainWaves must be positive. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [maxDrainWaves=" + maxDrainWaves + ", warnOnOverwrite="
        + warnOnOverwrite + ", trackStatistics=" + trackStatistics + "]";
  }

  private StateMachineConfiguration(final int maxDrainWaves, final boolean warnOnOverwrite,
      final boolean trackStatistics) {
    this.maxDrainWaves = maxDrainWaves;
    this.warnOnOverwrite = warnOnOverwrite;
    this.trackStatistics = trackStatistics;
  }

}
