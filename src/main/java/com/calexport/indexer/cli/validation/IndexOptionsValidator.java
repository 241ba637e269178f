package com.calexport.indexer.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.calexport.indexer.cli.exception.OptionsValidationException;
import com.calexport.indexer.cli.model.IndexOptions;
import com.calexport.indexer.cli.model.ValidatedIndexOptions;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.query.Direction;
import com.calexport.indexer.query.MemberCategory;
import com.calexport.indexer.reference.ReferenceType;

public class IndexOptionsValidator {

	public ValidatedIndexOptions validate(IndexOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> paths = new ArrayList<>();
		if (o.getPaths() == null || o.getPaths().isEmpty()) {
			errors.add("At least one export file or directory is required.");
		} else {
			for (Path p : o.getPaths()) {
				if (!Files.exists(p)) {
					errors.add("Path does not exist: " + p);
				} else {
					paths.add(p.toAbsolutePath().normalize());
				}
			}
		}

		Charset charset = isBlank(o.getCharset()) ? StandardCharsets.UTF_8 : parseCharset(o.getCharset().trim(), errors);

		if (isBlank(o.getFilePattern())) {
			errors.add("File pattern must not be empty (--file-pattern).");
		}

		ObjectKind kind = null;
		if (!isBlank(o.getKind())) {
			kind = ObjectKind.parse(o.getKind()).orElse(null);
			if (kind == null) {
				errors.add("Unknown object kind: " + o.getKind());
			}
		}

		if (o.getLimit() < 1) {
			errors.add("Limit must be >= 1. Got: " + o.getLimit());
		}
		if (o.getOffset() < 0) {
			errors.add("Offset must be >= 0. Got: " + o.getOffset());
		}

		if (!isBlank(o.getMembers()) && isBlank(o.getSummary())) {
			errors.add("--members needs the object given with --summary.");
		}
		if (!isBlank(o.getMembers()) && MemberCategory.parse(o.getMembers()).isEmpty()) {
			errors.add("Unknown member category: " + o.getMembers());
		}

		if (!isBlank(o.getReferenceType()) && ReferenceType.parse(o.getReferenceType()).isEmpty()) {
			errors.add("Unknown reference type: " + o.getReferenceType());
		}

		if (!isBlank(o.getDependencies()) && kind == null && isBlank(o.getKind())) {
			errors.add("--dependencies needs --kind.");
		}
		if (Direction.parse(o.getDirection()).isEmpty()) {
			errors.add("Direction must be incoming, outgoing or both. Got: " + o.getDirection());
		}

		if (o.getTableId() != null && o.getTableId() < 0) {
			errors.add("Table id must be >= 0. Got: " + o.getTableId());
		}

		Path reportPath = null;
		if (o.getReport() != null) {
			reportPath = o.getReport().toAbsolutePath().normalize();
			if (Files.isDirectory(reportPath)) {
				errors.add("Report path is a directory: " + reportPath);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedIndexOptions(List.copyOf(paths), charset, kind, reportPath);
	}

	private static Charset parseCharset(String name, List<String> errors) {
		try {
			if (Charset.isSupported(name)) {
				return Charset.forName(name);
			}
		} catch (IllegalCharsetNameException e) {
			errors.add("Illegal charset name: " + name);
			return null;
		}
		errors.add("Unsupported charset: " + name);
		return null;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
