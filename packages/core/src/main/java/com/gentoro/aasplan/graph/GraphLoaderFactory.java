package com.gentoro.aasplan.graph;

import com.gentoro.aasplan.exception.LoadException;
import java.nio.file.Path;
import java.util.Locale;

/** Picks a {@link GraphLoader} from the container's file extension. */
public final class GraphLoaderFactory {
  private GraphLoaderFactory() {}

  public static GraphLoader forPath(Path source) {
    if (source == null || source.getFileName() == null) {
      throw new LoadException("No container location given");
    }
    String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".aasx")) {
      return new AasxPackageGraphLoader();
    }
    if (name.endsWith(".json")) {
      return new AasJsonGraphLoader();
    }
    if (name.endsWith(".xml")) {
      return new AasXmlGraphLoader();
    }
    throw new LoadException("Unsupported container format: " + source.getFileName());
  }
}
