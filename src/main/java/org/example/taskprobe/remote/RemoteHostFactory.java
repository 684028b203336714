package org.example.taskprobe.remote;

import org.example.taskprobe.storage.ProbeConfig;

/** Opens a {@link RemoteHost} session for a probe configuration. */
@FunctionalInterface
public interface RemoteHostFactory {

  /**
   * Opens a session.
   *
   * @param config validated probe configuration
   * @return an open session; the caller closes it
   */
  RemoteHost open(ProbeConfig config);
}
