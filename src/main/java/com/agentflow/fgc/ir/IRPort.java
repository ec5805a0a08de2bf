package com.agentflow.fgc.ir;

/** A named input or output anchor of an IR node. */
public record IRPort(String id, String name, String label, String dataType, boolean optional, boolean list) {
}
