package com.calexport.indexer.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "cal-index" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class IndexOptions {

	@Parameters(arity = "1..*", paramLabel = "PATH", description = "Export files or directories to load")
	private List<Path> paths;

	@Option(names = { "--charset" }, defaultValue = "UTF-8", description = "Encoding of the export files (default: UTF-8)")
	private String charset;

	@Option(names = { "--file-pattern" }, defaultValue = "*.txt", description = "Glob for files inside directories (default: *.txt)")
	private String filePattern;

	@Option(names = { "--no-recursive" }, description = "Only load files directly inside the given directories")
	private boolean noRecursive;

	@Option(names = { "--kind", "-k" }, description = "Object kind to scope queries to (Table, Page, Codeunit, ...)")
	private String kind;

	@Option(names = { "--search", "-s" }, description = "Wildcard name pattern to search for, e.g. 'Cust*'")
	private String search;

	@Option(names = { "--limit" }, defaultValue = "20", description = "Maximum number of results (default: 20)")
	private int limit;

	@Option(names = { "--offset" }, defaultValue = "0", description = "Number of results to skip (default: 0)")
	private int offset;

	@Option(names = { "--summary" }, description = "Name or id of an object to summarize")
	private String summary;

	@Option(names = { "--members" }, description = "Member category to list for the --summary object (fields, procedures, controls, ...)")
	private String members;

	@Option(names = { "--references", "-r" }, description = "Name of an object to find references to")
	private String references;

	@Option(names = { "--field" }, description = "Restrict --references to one target field")
	private String field;

	@Option(names = { "--reference-type" }, description = "Restrict --references to one type (TableRelation, CalcFormula, ...)")
	private String referenceType;

	@Option(names = { "--dependencies", "-d" }, description = "Id or name of an object (with --kind) to show dependencies of")
	private String dependencies;

	@Option(names = { "--direction" }, defaultValue = "both", description = "incoming, outgoing or both (default: both)")
	private String direction;

	@Option(names = { "--relations" }, description = "Print the table relation map")
	private boolean relations;

	@Option(names = { "--table-id" }, description = "Restrict --relations to one table")
	private Integer tableId;

	@Option(names = { "--include-calc-formula" }, description = "Include CalcFormula edges in --relations")
	private boolean includeCalcFormula;

	@Option(names = { "--code" }, description = "Regular expression to search procedure bodies for")
	private String code;

	@Option(names = { "--report", "-o" }, description = "Write a markdown report to this file")
	private Path report;
}
