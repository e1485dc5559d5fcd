package com.yang.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.yang.generator.codegen.model.core.context.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Raw options of the "yang2rust" command, as picocli populated them. Checked by
 * {@code GenerateOptionsValidator} before use.
 */
@Getter
public class GenerateOptions {

	@Parameters(arity = "1..*", paramLabel = "<module.yang>", description = "YANG modules to translate")
	private List<Path> modules = new ArrayList<>();

	@Option(names = { "--path", "-p" }, description = "Directories searched for imported modules (comma-separated)")
	private String searchPath;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = {
			"--exclude-module" }, description = "Module that only contributes type information (repeatable, added to the defaults)")
	private List<String> excludedModules = new ArrayList<>();

	@Option(names = {
			"--exclude-path" }, description = "Structural path of a field to leave out (repeatable, added to the defaults)")
	private List<String> excludedPaths = new ArrayList<>();

	@Option(names = {
			"--exclude-typedef" }, description = "Path of a typedef that gets no alias (repeatable, added to the defaults)")
	private List<String> excludedTypedefs = new ArrayList<>();

	@Option(names = { "--copyright-holder" }, defaultValue = GeneratorConfig.DEFAULT_COPYRIGHT_HOLDER,
			description = "Copyright holder named in the generated header (default: ${DEFAULT-VALUE})")
	private String copyrightHolder;

	@Option(names = { "--copyright-year" }, description = "Copyright year (defaults to the current year)")
	private Integer copyrightYear;

	@Option(names = { "--fail-on-warnings" }, description = "Treat warnings as errors")
	private boolean failOnWarnings;
}
