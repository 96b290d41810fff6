package io.lrma.longsplit.infrastructure.sam;

import java.util.Objects;

/**
 * Provenance written as an {@code @PG} header line on every output file.
 *
 * @param programName value of the {@code PN} field
 * @param version value of the {@code VN} field
 * @param command subcommand name, appended to the record id
 * @param description value of the {@code DS} field
 * @param commandLine value of the {@code CL} field
 * @since 0.1.0
 */
public record ProgramInfo(
    String programName, String version, String command, String description, String commandLine) {

  /** Requires every field. */
  public ProgramInfo {
    Objects.requireNonNull(programName, "programName");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(commandLine, "commandLine");
  }

  /**
   * Returns the base program record id, {@code <programName>-<command>-<version>}.
   *
   * @return record id before any de-duplication suffix
   */
  public String recordId() {
    return programName + "-" + command + "-" + version;
  }
}
