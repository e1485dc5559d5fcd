package com.yang.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Year;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.yang.generator.cli.exception.OptionsValidationException;
import com.yang.generator.cli.model.GenerateOptions;
import com.yang.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	private static final String YANG_EXTENSION = ".yang";
	private static final int MIN_YEAR = 1970;
	private static final int MAX_YEAR = 9999;

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> inputFiles = new ArrayList<>();
		if (o.getModules() == null || o.getModules().isEmpty()) {
			errors.add("At least one YANG module file is required.");
		} else {
			for (Path module : o.getModules()) {
				Path normalized = module.toAbsolutePath().normalize();
				if (!Files.isRegularFile(normalized)) {
					errors.add("YANG module does not exist or is not a file: " + module);
				} else if (!normalized.getFileName().toString().endsWith(YANG_EXTENSION)) {
					errors.add("Not a .yang file: " + module);
				} else {
					inputFiles.add(normalized);
				}
			}
		}

		List<Path> searchDirs = parseSearchPath(o.getSearchPath(), errors);

		// Module directories are searched after the explicit ones
		Set<Path> allDirs = new LinkedHashSet<>(searchDirs);
		for (Path file : inputFiles) {
			if (file.getParent() != null) {
				allDirs.add(file.getParent());
			}
		}

		Path outputFile = null;
		if (o.getOutput() != null) {
			outputFile = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			} else if (Files.exists(outputFile) && !o.isForce()) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}
		}

		if (isBlank(o.getCopyrightHolder())) {
			errors.add("Copyright holder must not be blank (--copyright-holder).");
		}

		int year = o.getCopyrightYear() == null ? Year.now().getValue() : o.getCopyrightYear();
		if (year < MIN_YEAR || year > MAX_YEAR) {
			errors.add("Copyright year must be in range " + MIN_YEAR + "-" + MAX_YEAR + ". Got: " + year);
		}

		checkNotBlank(o.getExcludedModules(), "--exclude-module", errors);
		checkNotBlank(o.getExcludedPaths(), "--exclude-path", errors);
		checkNotBlank(o.getExcludedTypedefs(), "--exclude-typedef", errors);
		for (String path : o.getExcludedPaths()) {
			if (!isBlank(path) && !path.startsWith("/")) {
				errors.add("Excluded path must be absolute (start with '/'): " + path);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(inputFiles, new ArrayList<>(allDirs), outputFile, year);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static void checkNotBlank(List<String> values, String option, List<String> errors) {
		for (String value : values) {
			if (isBlank(value)) {
				errors.add("Blank value given for " + option + ".");
			}
		}
	}

	private static List<Path> parseSearchPath(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}

		List<Path> result = Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty())
				.map(s -> Path.of(s).toAbsolutePath().normalize()).toList();

		for (Path p : result) {
			if (!existsDirectory(p)) {
				errors.add("Search directory does not exist or is not a directory: " + p);
			}
		}

		return result;
	}
}
