package com.agentflow.fgc.emit;

import java.util.List;

/** Files produced by an emitter plus the dependency set written to the manifest. */
public record EmitResult(List<EmittedFile> files, List<String> dependencies) {

    public EmitResult {
        files = List.copyOf(files);
        dependencies = List.copyOf(dependencies);
    }

    /** Returns the file at {@code path}, or null. */
    public EmittedFile file(String path) {
        for (EmittedFile f : files)
            if (f.path().equals(path))
                return f;
        return null;
    }
}
