package com.plcexport.l5k.cli.validation;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import com.plcexport.l5k.cli.exception.OptionsValidationException;
import com.plcexport.l5k.cli.model.ExportOptions;
import com.plcexport.l5k.cli.model.ValidatedExportOptions;
import com.plcexport.l5k.model.EntityKey;

public class ExportOptionsValidator {

	public ValidatedExportOptions validate(ExportOptions o) {
		List<String> errors = new ArrayList<>();

		EntityKeyArguments.requireFile("Input export", o.getInput(), errors);
		if (o.getStatePath() != null) {
			EntityKeyArguments.requireFile("State file (--state)", o.getStatePath(), errors);
		}
		if (o.getOutput() != null && o.getInput() != null
				&& o.getOutput().toAbsolutePath().normalize().equals(o.getInput().toAbsolutePath().normalize())) {
			errors.add("Output must not overwrite the input export: " + o.getOutput());
		}

		Charset charset = EntityKeyArguments.parseCharset(o.getCharset(), errors);
		List<EntityKey> excluded = EntityKeyArguments.parseKeys("--exclude", o.getExclude(), errors);
		List<EntityKey> includeOnly = EntityKeyArguments.parseKeys("--include-only", o.getIncludeOnly(), errors);

		for (EntityKey key : excluded) {
			if (includeOnly.contains(key)) {
				errors.add("Entity is both excluded and included: " + key);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("export", errors);
		}

		return new ValidatedExportOptions(charset, excluded, includeOnly);
	}
}
