package com.snailc.emit;

import com.snailc.py.PyModule;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A lowered module together with the runtime helpers it references.
 */
public record Emission(PyModule module, Set<RuntimeHelper> helpers) {

    public Emission {
        helpers = helpers.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(RuntimeHelper.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(helpers));
    }

    /**
     * Import lines the module needs before it runs, one per referenced helper, empty when none are used.
     */
    public String preamble() {
        StringBuilder sb = new StringBuilder();
        for (RuntimeHelper helper : helpers) {
            sb.append("from ").append(RuntimeHelper.RUNTIME_MODULE)
                .append(" import ").append(helper.pythonName()).append('\n');
        }
        return sb.toString();
    }
}
