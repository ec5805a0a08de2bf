package com.agentflow.fgc.emit;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.engine.ConversionResult;
import com.agentflow.fgc.ir.IRGraph;

/**
 * Serializes an ordered fragment stream into target-language files and a
 * dependency manifest. Emitters never touch the filesystem.
 */
public interface Emitter {

    TargetLanguage language();

    EmitResult emit(IRGraph graph, ConversionResult result, GenerationContext ctx);
}
