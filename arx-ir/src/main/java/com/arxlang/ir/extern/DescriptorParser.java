package com.arxlang.ir.extern;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外部模块描述文件（{@code *.map}）解析器。
 *
 * <pre>
 * [meta]
 * name = io
 *
 * [functions]
 * print:str = io_print_str > void
 * print:int = io_print_int > void
 * now = io_now > int
 * </pre>
 *
 * <p>空行与 {@code #}、{@code ;} 开头的行忽略；键区分大小写；
 * 除 meta 与 functions 外的段忽略。</p>
 */
public class DescriptorParser {

    private static final String META = "meta";
    private static final String FUNCTIONS = "functions";

    public ModuleDescriptor parse(Path file) throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return parse(content, file.toString());
    }

    public ModuleDescriptor parse(String content, String source) {
        String section = null;
        String moduleName = null;
        boolean hasMeta = false;
        List<String[]> rawEntries = new ArrayList<>();   // {key, value, line}

        String[] lines = content.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]") || line.length() < 3) {
                    throw new DescriptorException("Malformed section header '" + line + "'", source, lineNo);
                }
                section = line.substring(1, line.length() - 1).trim();
                if (META.equals(section)) hasMeta = true;
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                throw new DescriptorException("Expected 'key = value', got '" + line + "'", source, lineNo);
            }
            if (section == null) {
                throw new DescriptorException("Entry outside of any section", source, lineNo);
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            if (key.isEmpty()) {
                throw new DescriptorException("Empty key", source, lineNo);
            }
            if (META.equals(section)) {
                if ("name".equals(key)) moduleName = value;
            } else if (FUNCTIONS.equals(section)) {
                rawEntries.add(new String[]{key, value, String.valueOf(lineNo)});
            }
        }

        if (!hasMeta) {
            throw new DescriptorException("Missing [meta] section", source, 0);
        }
        if (moduleName == null || moduleName.isEmpty()) {
            throw new DescriptorException("Missing 'name' in [meta] section", source, 0);
        }

        List<ExternOverload> overloads = new ArrayList<>(rawEntries.size());
        for (String[] raw : rawEntries) {
            overloads.add(parseEntry(moduleName, raw[0], raw[1], source, Integer.parseInt(raw[2])));
        }
        return new ModuleDescriptor(moduleName, source, overloads);
    }

    /**
     * {@code name[:argType,argType,...] = targetSymbol > returnType}
     */
    private ExternOverload parseEntry(String module, String key, String value, String source, int line) {
        String function = key;
        List<TypeTag> argTags = Collections.emptyList();
        int colon = key.indexOf(':');
        if (colon >= 0) {
            function = key.substring(0, colon).trim();
            String args = key.substring(colon + 1).trim();
            if (!args.isEmpty()) {
                argTags = new ArrayList<>();
                for (String arg : args.split(",", -1)) {
                    if (arg.trim().isEmpty()) {
                        throw new DescriptorException("Empty argument type in '" + key + "'", source, line);
                    }
                    argTags.add(TypeTag.canonicalize(arg));
                }
            }
        }
        if (function.isEmpty()) {
            throw new DescriptorException("Missing function name in '" + key + "'", source, line);
        }

        int gt = value.indexOf('>');
        if (gt < 0 || value.indexOf('>', gt + 1) >= 0) {
            throw new DescriptorException("Expected 'targetSymbol > returnType', got '" + value + "'", source, line);
        }
        String target = value.substring(0, gt).trim();
        String returnTag = value.substring(gt + 1).trim();
        if (target.isEmpty() || returnTag.isEmpty()) {
            throw new DescriptorException("Expected 'targetSymbol > returnType', got '" + value + "'", source, line);
        }
        return new ExternOverload(module, function, argTags, target, returnTag, line);
    }
}
