package com.snailc.emit;

import com.snailc.py.PyModule;

/**
 * Final pipeline stage: pairs the module with the helpers it needs.
 */
public final class Emitter {

    private Emitter() {
    }

    public static Emission emit(PyModule module) {
        return new Emission(module, HelperUsageScanner.scan(module));
    }
}
