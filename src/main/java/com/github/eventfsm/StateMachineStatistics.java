package com.github.eventfsm;

/**
 * Holder of statistics for one machine. Counters are bumped by the machine as it processes waves;
 * they are purely observational.
 */
public final class StateMachineStatistics {
  private final String machineId;
  private final String machineName;

  StateMachineStatistics(final String machineId, final String machineName) {
    this.machineId = machineId;
    this.machineName = machineName;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  long wavesProcessed;
  long eventsProcessed;
  long transitionsApplied;
  long hooksFired;
  long waveFailures;
  long registrationOverwrites;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getMachineId() {
    return machineId;
  }

  public String getMachineName() {
    return machineName;
  }

  public long getWavesProcessed() {
    return wavesProcessed;
  }

  /**
   * Events that were taken off the queue and considered, whether or not their transition succeeded.
   */
  public long getEventsProcessed() {
    return eventsProcessed;
  }

  public long getTransitionsApplied() {
    return transitionsApplied;
  }

  public long getHooksFired() {
    return hooksFired;
  }

  public long getWaveFailures() {
    return waveFailures;
  }

  public long getRegistrationOverwrites() {
    return registrationOverwrites;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [machineId=" + machineId + ", machineName=" + machineName
        + ", startTstampMillis=" + startTstampMillis + ", wavesProcessed=" + wavesProcessed
        + ", eventsProcessed=" + eventsProcessed + ", transitionsApplied=" + transitionsApplied
        + ", hooksFired=" + hooksFired + ", waveFailures=" + waveFailures
        + ", registrationOverwrites=" + registrationOverwrites + "]";
  }

}
