package org.apache.arrow.ballista.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options controlling where and how shuffle partition files are written.
 *
 * @param workDir root directory under which partition files are laid out as {@code
 *     <workDir>/<jobId>/<stageId>/<partition>/<dataFileName>}
 * @param syncOnFinish whether to fsync a partition file before renaming it into place
 * @param overwriteExisting whether a finalized partition file may be replaced by a re-execution
 * @param dataFileName file name of each partition file
 */
public record ShuffleOptions(
    Path workDir, boolean syncOnFinish, boolean overwriteExisting, String dataFileName) {

  static final String PREFIX = "ballista.shuffle.";

  public static final String DEFAULT_DATA_FILE_NAME = "data.arrow";

  public ShuffleOptions {
    if (workDir == null) {
      workDir = Path.of(System.getProperty("java.io.tmpdir"), "ballista");
    }
    if (dataFileName == null || dataFileName.isBlank()) {
      dataFileName = DEFAULT_DATA_FILE_NAME;
    }
  }

  /** Returns the default options: temp-dir work dir, fsync on, no overwrite. */
  public static ShuffleOptions defaults() {
    return builder().build();
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the path of one partition file.
   *
   * @param jobId the job id
   * @param stageId the stage id
   * @param partition the output partition
   * @return the partition file path
   */
  public Path partitionFile(String jobId, int stageId, int partition) {
    return workDir
        .resolve(jobId)
        .resolve(Integer.toString(stageId))
        .resolve(Integer.toString(partition))
        .resolve(dataFileName);
  }

  /** Writes the options to the map with dotted keys. */
  void writeTo(Map<String, String> map) {
    map.put(PREFIX + "work_dir", workDir.toString());
    map.put(PREFIX + "sync_on_finish", Boolean.toString(syncOnFinish));
    map.put(PREFIX + "overwrite_existing", Boolean.toString(overwriteExisting));
    map.put(PREFIX + "data_file_name", dataFileName);
  }

  /** Applies one dotted-key option to the builder; returns false if the key is unknown. */
  static boolean apply(Builder builder, String key, String value) {
    switch (key) {
      case PREFIX + "work_dir" -> builder.workDir(Path.of(value));
      case PREFIX + "sync_on_finish" -> builder.syncOnFinish(ConfigValues.parseBoolean(key, value));
      case PREFIX + "overwrite_existing" ->
          builder.overwriteExisting(ConfigValues.parseBoolean(key, value));
      case PREFIX + "data_file_name" -> builder.dataFileName(value);
      default -> {
        return false;
      }
    }
    return true;
  }

  /** Builder for {@link ShuffleOptions}. */
  public static final class Builder {
    private Path workDir;
    private boolean syncOnFinish = true;
    private boolean overwriteExisting = false;
    private String dataFileName;

    private Builder() {}

    /** Root directory for partition files. Default is {@code <java.io.tmpdir>/ballista}. */
    public Builder workDir(Path value) {
      this.workDir = value;
      return this;
    }

    /** Whether to fsync each partition file before it becomes visible. Default is true. */
    public Builder syncOnFinish(boolean value) {
      this.syncOnFinish = value;
      return this;
    }

    /** Whether re-executions may replace existing partition files. Default is false. */
    public Builder overwriteExisting(boolean value) {
      this.overwriteExisting = value;
      return this;
    }

    /** File name of each partition file. Default is {@code data.arrow}. */
    public Builder dataFileName(String value) {
      this.dataFileName = value;
      return this;
    }

    public ShuffleOptions build() {
      return new ShuffleOptions(workDir, syncOnFinish, overwriteExisting, dataFileName);
    }
  }
}
