package com.plcexport.l5k.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "diff" command.
 */
@Getter
public class DiffOptions {

	@Parameters(index = "0", paramLabel = "CURRENT", description = "The export being tuned")
	private Path current;

	@Parameters(index = "1", paramLabel = "UPDATED", description = "A newer export of the same controller")
	private Path updated;

	@Option(names = { "--state" }, description = "Saved tree state (JSON) of the current export")
	private Path statePath;

	@Option(names = { "--apply" }, description = "Apply the changes to the current export")
	private boolean apply;

	@Option(names = { "--accept-added" }, split = ",", paramLabel = "KEY", description = "Only apply these additions (requires --apply)")
	private List<String> acceptAdded = new ArrayList<>();

	@Option(names = { "--accept-removed" }, split = ",", paramLabel = "KEY", description = "Only apply these removals (requires --apply)")
	private List<String> acceptRemoved = new ArrayList<>();

	@Option(names = { "--output", "-o" }, description = "Where to write the merged export (requires --apply)")
	private Path output;

	@Option(names = { "--save-state" }, description = "Write the merged tree state (JSON) to this file (requires --apply)")
	private Path saveStatePath;

	@Option(names = { "--charset" }, defaultValue = "UTF-8", description = "Charset of the input and output files (default: UTF-8)")
	private String charset;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

	/**
	 * True when specific changes were listed rather than accepting all of them.
	 */
	public boolean hasExplicitSelection() {
		return !acceptAdded.isEmpty() || !acceptRemoved.isEmpty();
	}
}
