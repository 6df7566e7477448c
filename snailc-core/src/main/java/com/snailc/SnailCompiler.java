package com.snailc;

import com.snailc.ast.Program;
import com.snailc.ast.Statement;
import com.snailc.emit.Emission;
import com.snailc.emit.Emitter;
import com.snailc.lower.LowerOptions;
import com.snailc.lower.Lowerer;
import com.snailc.py.PyModule;
import com.snailc.validate.ValidationMode;
import com.snailc.validate.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point running the whole pipeline: preprocess, parse, validate, lower and emit.
 *
 * <p>Every stage reports bad input with a {@link SnailException}; nothing is printed.
 */
public final class SnailCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(SnailCompiler.class);

    private SnailCompiler() {
    }

    public static CompilationResult compile(String source) {
        return compile(source, CompileOptions.defaults());
    }

    public static CompilationResult compile(String source, CompileOptions options) {
        LOG.debug("Compiling {} in {} mode ({} chars)", options.filename(), options.mode(), source.length());

        Program program = parse(source, options);
        validate(program, ValidationMode.of(options.mode()));

        List<Program> sections = sections(program, options);
        if (sections.size() > 1) {
            List<Statement> all = new ArrayList<>();
            for (Program section : sections) {
                all.addAll(section.body());
            }
            program = new Program(program.span(), all);
        }

        PyModule module = Lowerer.lower(sections, program.span(), new LowerOptions(options.autoPrint()));
        LOG.debug("Lowered {} to {} top-level Python statement(s)", options.filename(), module.body().size());

        Emission emission = Emitter.emit(module);
        LOG.debug("Emission of {} references {} runtime helper(s): {}",
            options.filename(), emission.helpers().size(), emission.helpers());
        return new CompilationResult(program, emission);
    }

    public static Program parse(String source, CompileOptions options) {
        Program program = Parser.parse(source, options);
        LOG.debug("Parsed {} top-level statement(s)", program.body().size());
        return program;
    }

    public static void validate(Program program, ValidationMode mode) {
        Validator.validate(program, mode);
        LOG.debug("Validated program in {} mode", mode);
    }

    /**
     * Begin code, the main program and end code, in run order. Begin and end code are plain Snail,
     * outside the reach of awk or map variables.
     */
    private static List<Program> sections(Program main, CompileOptions options) {
        if (options.beginCode().isEmpty() && options.endCode().isEmpty()) {
            return List.of(main);
        }
        CompileOptions plain = options.toBuilder()
            .mode(CompileMode.SNAIL)
            .beginCode(List.of())
            .endCode(List.of())
            .build();
        List<Program> sections = new ArrayList<>();
        for (String begin : options.beginCode()) {
            sections.add(plainSection(begin, plain, "begin"));
        }
        sections.add(main);
        for (String end : options.endCode()) {
            sections.add(plainSection(end, plain, "end"));
        }
        return sections;
    }

    private static Program plainSection(String code, CompileOptions plain, String section) {
        Program program = Parser.parse(code, plain);
        Validator.validate(program, ValidationMode.SNAIL);
        LOG.debug("Spliced {} statement(s) of {} code", program.body().size(), section);
        return program;
    }
}
