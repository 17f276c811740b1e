package com.plcexport.l5k.cli.validation;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import com.plcexport.l5k.cli.exception.OptionsValidationException;
import com.plcexport.l5k.cli.model.DiffOptions;
import com.plcexport.l5k.cli.model.ValidatedDiffOptions;
import com.plcexport.l5k.model.EntityKey;

public class DiffOptionsValidator {

	public ValidatedDiffOptions validate(DiffOptions o) {
		List<String> errors = new ArrayList<>();

		EntityKeyArguments.requireFile("Current export", o.getCurrent(), errors);
		EntityKeyArguments.requireFile("Updated export", o.getUpdated(), errors);
		if (o.getStatePath() != null) {
			EntityKeyArguments.requireFile("State file (--state)", o.getStatePath(), errors);
		}

		if (!o.isApply()) {
			if (o.hasExplicitSelection()) {
				errors.add("--accept-added and --accept-removed require --apply.");
			}
			if (o.getOutput() != null) {
				errors.add("--output requires --apply.");
			}
			if (o.getSaveStatePath() != null) {
				errors.add("--save-state requires --apply.");
			}
		}

		Charset charset = EntityKeyArguments.parseCharset(o.getCharset(), errors);
		List<EntityKey> added = EntityKeyArguments.parseKeys("--accept-added", o.getAcceptAdded(), errors);
		List<EntityKey> removed = EntityKeyArguments.parseKeys("--accept-removed", o.getAcceptRemoved(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("diff", errors);
		}

		return new ValidatedDiffOptions(charset, added, removed);
	}
}
