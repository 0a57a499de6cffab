package com.gentoro.aasplan.graph;

import com.gentoro.aasplan.exception.LoadException;
import java.nio.file.Path;

/** Reads a container file into an {@link ElementGraph}. */
public interface GraphLoader {

  /**
   * Load the container.
   *
   * @throws LoadException if the file is unreadable or does not hold an element graph
   */
  ElementGraph load(Path source);
}
