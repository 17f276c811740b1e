package com.plcexport.l5k.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "export" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExportOptions {

	@Parameters(index = "0", paramLabel = "INPUT", description = "L5K export to read")
	private Path input;

	@Option(names = { "--output", "-o" }, description = "Where to write the filtered export (defaults to standard output)")
	private Path output;

	@Option(names = { "--state" }, description = "Saved tree state (JSON) to apply before exporting")
	private Path statePath;

	@Option(names = { "--exclude" }, split = ",", paramLabel = "KEY", description = "Entities to leave out, e.g. UDT:Motor or PROGRAM_TAG:Main/Count")
	private List<String> exclude = new ArrayList<>();

	@Option(names = { "--include-only" }, split = ",", paramLabel = "KEY", description = "Deselect everything, then include only these entities")
	private List<String> includeOnly = new ArrayList<>();

	@Option(names = { "--save-state" }, description = "Write the resulting tree state (JSON) to this file")
	private Path saveStatePath;

	@Option(names = { "--charset" }, defaultValue = "UTF-8", description = "Charset of the input and output files (default: UTF-8)")
	private String charset;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
