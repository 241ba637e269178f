package com.calexport.indexer.parser.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.model.Parameter;
import com.calexport.indexer.model.Variable;
import com.calexport.indexer.model.VariableKind;

/**
 * Typed declarations of VAR blocks and procedure parameter lists.
 *
 * <pre>
 *   Cust@1000 : Record 18;
 *   GLAcc@1001 : Record "G/L Account";
 *   TempBuf@1002 : TEMPORARY Record 379;
 *   Str@1003 : DotNet "'mscorlib, Version=4.0.0.0'.System.String" RUNONCLIENT;
 *   Text000@1004 : TextConst 'ENU=Posting %1;@@@=%1 = document no.';
 *   Amounts@1005 : ARRAY [2,4] OF Decimal;
 * </pre>
 *
 * A declaration that does not match yields nothing; a type it cannot read is kept as PLAIN.
 */
public class VariableDeclarationParser {
    private static final Logger log = LoggerFactory.getLogger(VariableDeclarationParser.class);

    private static final Pattern DECLARATION = Pattern.compile(
            "^(VAR\\s+)?(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))(?:@(\\d{1,9}))?\\s*:\\s*([\\s\\S]+)$");
    private static final Pattern TRAILING_MODIFIER = Pattern.compile(
            "\\s+(?:RUNONCLIENT|WITHEVENTS|INDATASET|TEMPORARY|SECURITYFILTERING\\([^)]*\\))$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TEMPORARY_PREFIX = Pattern.compile("^TEMPORARY\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARRAY = Pattern.compile("^ARRAY\\s*\\[(\\s*\\d{1,9}\\s*(?:,\\s*\\d{1,9}\\s*)*)\\]\\s*OF\\s+([\\s\\S]+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern EXTERNAL = Pattern.compile("^(DotNet|Automation)\\s+\"'(.*)'\\.([^'\"]+)\"$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TEXT_CONST = Pattern.compile("^TextConst\\s+'([\\s\\S]*)'$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_BY_ID = Pattern.compile(
            "^(Record|Codeunit|Page|Report|Query|XMLport|Form)\\s+(\\d{1,10})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_BY_NAME = Pattern.compile(
            "^(Record|Codeunit|Page|Report|Query|XMLport|Form)\\s+(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SIMPLE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)(?:\\s*\\[\\s*(\\d{1,9})\\s*\\])?");

    private final LocalizedTextParser localizedTextParser = new LocalizedTextParser();

    /**
     * Every declaration of a VAR block body (the text after the VAR keyword).
     */
    public List<Variable> parseBlock(String text) {
        List<Variable> variables = new ArrayList<>();
        if (text == null) {
            return variables;
        }
        for (String piece : TextScanner.splitTopLevel(text, ';', true)) {
            if (piece.isBlank()) {
                continue;
            }
            Optional<Variable> variable = parse(piece);
            if (variable.isPresent()) {
                variables.add(variable.get());
            } else {
                log.debug("Skipping unreadable declaration: {}", TextScanner.collapseWhitespace(piece));
            }
        }
        return variables;
    }

    public Optional<Variable> parse(String declaration) {
        if (declaration == null) {
            return Optional.empty();
        }
        String text = declaration.trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        Matcher m = DECLARATION.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        String name = m.group(2) != null ? m.group(2) : m.group(3);
        int id = m.group(4) != null ? Integer.parseInt(m.group(4)) : 0;
        Variable.VariableBuilder builder = Variable.builder()
                .name(name)
                .id(id)
                .byRef(m.group(1) != null);
        readType(TextScanner.collapseWhitespace(m.group(5)), builder);
        return Optional.of(builder.build());
    }

    /**
     * Parameter list between the parentheses of a procedure header.
     */
    public List<Parameter> parseParameters(String text) {
        List<Parameter> parameters = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return parameters;
        }
        for (String piece : TextScanner.splitTopLevel(text, ';', true)) {
            parse(piece).ifPresent(v -> parameters.add(Parameter.builder()
                    .name(v.getName())
                    .id(v.getId())
                    .type(v.getDeclaredType())
                    .byRef(v.isByRef())
                    .temporary(v.isTemporary())
                    .build()));
        }
        return parameters;
    }

    /**
     * Reads a type declaration on its own, for callers that only have the type text of a parameter.
     */
    public Variable parseType(String name, int id, String typeText) {
        Variable.VariableBuilder builder = Variable.builder().name(name).id(id);
        readType(TextScanner.collapseWhitespace(typeText), builder);
        return builder.build();
    }

    private void readType(String typeText, Variable.VariableBuilder builder) {
        builder.declaredType(typeText);
        String spec = typeText;

        boolean temporary = TEMPORARY_PREFIX.matcher(spec).find();
        spec = TEMPORARY_PREFIX.matcher(spec).replaceFirst("");
        Matcher trailing = TRAILING_MODIFIER.matcher(spec);
        while (trailing.find()) {
            temporary |= trailing.group().trim().equalsIgnoreCase("TEMPORARY");
            spec = spec.substring(0, trailing.start());
            trailing = TRAILING_MODIFIER.matcher(spec);
        }
        builder.temporary(temporary);

        Matcher array = ARRAY.matcher(spec);
        if (array.matches()) {
            for (String dim : array.group(1).split(",")) {
                if (!dim.isBlank()) {
                    builder.dimension(Integer.parseInt(dim.trim()));
                }
            }
            spec = array.group(2).trim();
        }

        Matcher external = EXTERNAL.matcher(spec);
        if (external.matches()) {
            builder.typeTag(external.group(1))
                    .kind(VariableKind.EXTERNAL_TYPE)
                    .assembly(external.group(2))
                    .typePath(external.group(3));
            return;
        }

        Matcher textConst = TEXT_CONST.matcher(spec);
        if (textConst.matches()) {
            builder.typeTag("TextConst");
            localizedTextParser.parseTextConst(textConst.group(1)).ifPresent(lt -> builder
                    .kind(VariableKind.LOCALIZED_TEXT)
                    .texts(lt.getTexts())
                    .translatorComment(lt.getTranslatorComment()));
            return;
        }

        Matcher byId = OBJECT_BY_ID.matcher(spec);
        if (byId.matches() && TextScanner.toInt(byId.group(2)) != null) {
            builder.typeTag(byId.group(1))
                    .kind(VariableKind.OBJECT_ID)
                    .objectId(TextScanner.toInt(byId.group(2)));
            return;
        }

        Matcher byName = OBJECT_BY_NAME.matcher(spec);
        if (byName.matches()) {
            builder.typeTag(byName.group(1))
                    .kind(VariableKind.OBJECT_NAME)
                    .objectName(byName.group(2) != null ? byName.group(2) : byName.group(3));
            return;
        }

        if (spec.startsWith("'")) {
            builder.typeTag("Option");
            return;
        }

        Matcher simple = SIMPLE.matcher(spec);
        if (simple.find()) {
            builder.typeTag(simple.group(1));
            if (simple.group(2) != null) {
                builder.length(Integer.parseInt(simple.group(2)));
            }
        } else {
            builder.typeTag(spec);
        }
    }
}
