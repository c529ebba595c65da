package com.example.flowbridge.ir;

/**
 * Where a tool runs: {@code SERVER} is a local function call, {@code CLIENT} needs the user to confirm or answer.
 */
public enum ToolKind {
    SERVER,
    CLIENT
}
