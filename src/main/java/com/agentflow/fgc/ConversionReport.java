package com.agentflow.fgc;

import com.agentflow.fgc.api.ValidationResult;
import com.agentflow.fgc.emit.EmitResult;
import com.agentflow.fgc.engine.ConversionResult;
import com.agentflow.fgc.ir.IRGraph;

/**
 * Everything one {@link FlowGraphConverter#convert} call produced.
 *
 * @param output emitted files, null when the conversion aborted
 */
public record ConversionReport(IRGraph graph, ValidationResult validation, ConversionResult conversion,
        EmitResult output) {

    public boolean hasOutput() {
        return output != null;
    }
}
