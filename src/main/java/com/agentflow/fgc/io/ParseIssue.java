package com.agentflow.fgc.io;

/**
 * One structural problem found while parsing a flow.
 *
 * @param path    JSON path of the offending element, e.g. {@code $.nodes[2].id}
 * @param message what is wrong with it
 */
public record ParseIssue(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
