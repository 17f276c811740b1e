package com.plcexport.l5k.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;

import lombok.experimental.UtilityClass;

/**
 * Checks shared by the command validators. Problems are appended to the error list.
 */
@UtilityClass
class EntityKeyArguments {

	static List<EntityKey> parseKeys(String option, List<String> raw, List<String> errors) {
		List<EntityKey> keys = new ArrayList<>();
		if (raw == null) {
			return keys;
		}
		for (String text : raw) {
			if (text == null || text.isBlank()) {
				continue;
			}
			try {
				EntityKey key = EntityKey.parse(text.trim());
				if (key.getKind() == EntityKind.HEADER) {
					errors.add(option + ": the header cannot be selected: " + text);
				} else {
					keys.add(key);
				}
			} catch (IllegalArgumentException e) {
				errors.add(option + ": " + e.getMessage());
			}
		}
		return keys;
	}

	static Charset parseCharset(String name, List<String> errors) {
		if (name == null || name.isBlank()) {
			errors.add("Charset must not be blank (--charset).");
			return null;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalArgumentException e) {
			errors.add("Unsupported charset: " + name);
			return null;
		}
	}

	static void requireFile(String what, Path p, List<String> errors) {
		if (p == null) {
			errors.add(what + " is required.");
		} else if (!Files.isRegularFile(p)) {
			errors.add(what + " does not exist or is not a file: " + p);
		}
	}
}
