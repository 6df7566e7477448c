package com.snailc;

import com.snailc.ast.Program;
import com.snailc.emit.Emission;
import com.snailc.emit.PythonSourceWriter;
import com.snailc.emit.RuntimeHelper;
import com.snailc.py.PyModule;

import java.util.Set;

/**
 * Output of a successful compilation.
 *
 * @param program  the parsed Snail program, after begin/end splicing
 * @param emission the lowered module with the runtime helpers it uses
 */
public record CompilationResult(Program program, Emission emission) {

    public PyModule module() {
        return emission.module();
    }

    public Set<RuntimeHelper> helpers() {
        return emission.helpers();
    }

    /** Helper imports followed by the rendered module. */
    public String pythonSource() {
        return emission.preamble() + PythonSourceWriter.write(emission.module());
    }
}
