package com.calexport.indexer.parser.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.model.Variable;

/**
 * Reads the body of a CODE section:
 *
 * <pre>
 *   VAR
 *     Cust@1000 : Record 18;
 *
 *   [External]
 *   LOCAL PROCEDURE Post@1(VAR SalesHeader@1000 : Record 36;Preview@1001 : Boolean) : Boolean;
 *   VAR
 *     Line@1002 : Record 37;
 *   BEGIN
 *     ...
 *   END;
 *
 *   BEGIN
 *   {
 *     documentation
 *   }
 *   END.
 * </pre>
 */
public class CodeSectionParser {
    private static final Logger log = LoggerFactory.getLogger(CodeSectionParser.class);

    private static final Pattern PROCEDURE_HEADER = Pattern.compile(
            "(?m)^[ \\t]*((?:\\[[^\\r\\n]*\\][ \\t]*\\r?\\n[ \\t]*)*)(LOCAL[ \\t]+)?PROCEDURE[ \\t]+"
                    + "(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))(?:@(\\d{1,9}))?[ \\t]*\\(");
    private static final Pattern VAR_LINE = Pattern.compile("(?m)^[ \\t]*VAR\\b");
    private static final Pattern BEGIN_LINE = Pattern.compile("(?m)^[ \\t]*BEGIN\\b");
    private static final Pattern LEADING_BLANK_LINES = Pattern.compile("^(?:[ \\t]*\\R)+");

    private final VariableDeclarationParser variableParser;

    public CodeSectionParser() {
        this(new VariableDeclarationParser());
    }

    public CodeSectionParser(VariableDeclarationParser variableParser) {
        this.variableParser = variableParser;
    }

    public CodeSection parse(String code) {
        if (code == null || code.isBlank()) {
            return CodeSection.EMPTY;
        }
        List<MatchResult> headers = new ArrayList<>();
        Matcher m = PROCEDURE_HEADER.matcher(code);
        while (m.find()) {
            headers.add(m.toMatchResult());
        }

        int globalsEnd = headers.isEmpty() ? code.length() : headers.get(0).start();
        List<Variable> globals = parseVarBlock(code.substring(0, globalsEnd));

        List<Procedure> procedures = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            int segmentEnd = i + 1 < headers.size() ? headers.get(i + 1).start() : code.length();
            Procedure procedure = parseProcedure(code, headers.get(i), headers.get(i).end() - 1, segmentEnd);
            if (procedure != null) {
                procedures.add(procedure);
            }
        }
        return new CodeSection(globals, procedures);
    }

    private Procedure parseProcedure(String code, MatchResult header, int openParen, int segmentEnd) {
        int closeParen = TextScanner.matchingClose(code, openParen, true);
        if (closeParen < 0 || closeParen > segmentEnd) {
            log.debug("Unterminated parameter list for procedure {}", name(header));
            return null;
        }
        int headerEnd = TextScanner.indexOfTopLevel(code, ';', closeParen + 1, true);
        if (headerEnd < 0 || headerEnd > segmentEnd) {
            headerEnd = closeParen;
        }
        String returnPart = code.substring(closeParen + 1, headerEnd);
        int colon = returnPart.indexOf(':');
        String returnType = colon < 0 ? null : TextScanner.collapseWhitespace(returnPart.substring(colon + 1));

        Procedure.ProcedureBuilder builder = Procedure.builder()
                .name(name(header))
                .id(header.group(5) != null ? Integer.parseInt(header.group(5)) : 0)
                .local(header.group(2) != null)
                .returnType(returnType == null || returnType.isEmpty() ? null : returnType)
                .parameters(variableParser.parseParameters(code.substring(openParen + 1, closeParen)));

        for (String line : header.group(1).split("\\R")) {
            if (!line.isBlank()) {
                builder.attribute(line.trim());
            }
        }

        String segment = code.substring(headerEnd + 1 > segmentEnd ? segmentEnd : headerEnd + 1, segmentEnd);
        Matcher begin = BEGIN_LINE.matcher(segment);
        if (!begin.find()) {
            builder.localVariables(parseVarBlock(segment));
            return builder.build();
        }
        int beginIndex = begin.end() - "BEGIN".length();
        builder.localVariables(parseVarBlock(segment.substring(0, beginIndex)));

        int end = BeginEndMatcher.findEnd(segment, beginIndex);
        if (end < 0) {
            log.debug("No END for body of procedure {}", name(header));
            end = segment.length();
        } else {
            end -= "END".length();
        }
        builder.body(bodyText(segment, beginIndex + "BEGIN".length(), end));
        return builder.build();
    }

    private List<Variable> parseVarBlock(String text) {
        Matcher var = VAR_LINE.matcher(text);
        if (!var.find()) {
            return List.of();
        }
        String declarations = text.substring(var.end());
        Matcher begin = BEGIN_LINE.matcher(declarations);
        if (begin.find()) {
            declarations = declarations.substring(0, begin.start());
        }
        return variableParser.parseBlock(declarations);
    }

    /**
     * Lines strictly between the BEGIN line and the END line, with common indentation removed.
     */
    private static String bodyText(String segment, int from, int to) {
        int start = segment.indexOf('\n', from);
        start = start < 0 || start > to ? from : start + 1;
        int stop = segment.lastIndexOf('\n', to - 1);
        stop = stop < start ? to : stop;
        String raw = segment.substring(start, stop);
        if (raw.isBlank()) {
            return "";
        }
        return LEADING_BLANK_LINES.matcher(raw.stripIndent()).replaceFirst("").stripTrailing();
    }

    private static String name(MatchResult header) {
        return header.group(3) != null ? header.group(3) : header.group(4);
    }
}
