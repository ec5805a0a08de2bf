package com.agentflow.fgc.emit;

import com.agentflow.fgc.api.TargetLanguage;

public final class Emitters {

    private Emitters() {
        // Utility class
    }

    public static Emitter forLanguage(TargetLanguage language) {
        return switch (language) {
            case TYPESCRIPT -> new TypeScriptEmitter();
            case PYTHON -> new PythonEmitter();
        };
    }
}
